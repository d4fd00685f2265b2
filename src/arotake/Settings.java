/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The settings of a run. Defaults are replaced by values from the
 * arotake.properties file in the working directory, which may in turn be
 * replaced from the command line.
 */
public class Settings {

    private static final Logger logger = LoggerFactory.getLogger(Settings.class);

    /**
     * File name of the properties file (excluding the file path) holding
     * the arotake settings.
     */
    final static String PROPERTY_FILE_NAME = "arotake.properties";

    /**
     * Name of the property giving the root of the archive directory tree.
     */
    final static String ROOT_DIRECTORY_PROPERTY_NAME = "rootdir";

    /**
     * Name of the property giving the UT time (HH:mm:ss) that ends an
     * observing night. If absent each instrument's own time is used.
     */
    final static String END_TIME_PROPERTY_NAME = "endtime";

    /**
     * Name of the property giving the version written to DQA_VERS.
     */
    final static String DQA_VERSION_PROPERTY_NAME = "dqa.version";

    /**
     * Name of the property that enables updates of the tracking database.
     */
    final static String STATUS_UPDATES_PROPERTY_NAME = "status.updates";

    /**
     * The root of the archive directory tree.
     */
    private String rootDirectory = "koadata";

    /**
     * The end of the observing night, or null to use the instrument's.
     */
    private String endTime = null;

    /**
     * The version of the assessment written into every header.
     */
    private String dqaVersion = "1.0";

    /**
     * True if the tracking database should be told about the batch.
     */
    private boolean statusUpdates = false;

    public String getRootDirectory() {
        return rootDirectory;
    }

    public void setRootDirectory(String rootDirectory) {
        if (rootDirectory == null || rootDirectory.trim().length() == 0) {
            throw new IllegalArgumentException("The root directory cannot be blank.");
        }
        this.rootDirectory = rootDirectory.trim();
    }

    public String getEndTime() {
        return endTime;
    }

    public void setEndTime(String endTime) {
        if (endTime != null) {
            // Rejects malformed times before any file is processed.
            IdentifierValidator.toSeconds(endTime);
        }
        this.endTime = endTime;
    }

    public String getDqaVersion() {
        return dqaVersion;
    }

    public void setDqaVersion(String dqaVersion) {
        this.dqaVersion = dqaVersion;
    }

    public boolean isStatusUpdates() {
        return statusUpdates;
    }

    public void setStatusUpdates(boolean statusUpdates) {
        this.statusUpdates = statusUpdates;
    }

    /**
     * Applies the recognised properties that are present. Others are
     * ignored, as are malformed values, which leave the current setting in
     * place.
     */
    public void apply(Properties properties) {
        String rootProperty = properties.getProperty(ROOT_DIRECTORY_PROPERTY_NAME);
        String endTimeProperty = properties.getProperty(END_TIME_PROPERTY_NAME);
        String versionProperty = properties.getProperty(DQA_VERSION_PROPERTY_NAME);
        String statusProperty = properties.getProperty(STATUS_UPDATES_PROPERTY_NAME);

        // Only replace the settings whose properties were present.
        if (rootProperty != null) {
            try {
                setRootDirectory(rootProperty);
            } catch (IllegalArgumentException ex) {
                logger.warn("Ignoring {} setting, keeping {}", ROOT_DIRECTORY_PROPERTY_NAME, rootDirectory, ex);
            }
        }

        if (endTimeProperty != null) {
            try {
                setEndTime(endTimeProperty.trim());
            } catch (IllegalArgumentException ex) {
                logger.warn("Ignoring {} setting '{}', keeping {}", END_TIME_PROPERTY_NAME, endTimeProperty, endTime,
                        ex);
            }
        }

        if (versionProperty != null) {
            setDqaVersion(versionProperty.trim());
        }

        if (statusProperty != null) {
            setStatusUpdates(Boolean.parseBoolean(statusProperty.trim()));
        }
    }

    /**
     * Loads settings from the arotake.properties file in the working
     * directory, if there is one.
     */
    public void loadPropertiesFromFile() {
        loadPropertiesFromFile(new File(System.getProperty("user.dir"), PROPERTY_FILE_NAME));
    }

    public void loadPropertiesFromFile(File propertiesFile) {
        if (!propertiesFile.exists()) {
            // The user may not have created a properties file.
            logger.info("No settings file at {}, using defaults", propertiesFile);
            return;
        }

        try {
            FileInputStream stream = new FileInputStream(propertiesFile);
            Properties properties = new Properties();
            try {
                properties.load(stream);
            } finally {
                stream.close();
            }
            apply(properties);
            logger.info("Loaded settings from {}", propertiesFile);
        } catch (IOException ex) {
            logger.warn("Could not load settings from {}, using defaults", propertiesFile, ex);
        }
    }

    @Override
    public String toString() {
        return ROOT_DIRECTORY_PROPERTY_NAME + "=" + rootDirectory + ", " + END_TIME_PROPERTY_NAME + "=" + endTime
                + ", " + DQA_VERSION_PROPERTY_NAME + "=" + dqaVersion + ", " + STATUS_UPDATES_PROPERTY_NAME + "="
                + statusUpdates;
    }
}
