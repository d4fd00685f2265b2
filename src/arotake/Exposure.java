/*
* Copyright 2007-2010 The Authors (see AUTHORS)
* This file is part of Arotake, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package arotake;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import nom.tam.fits.BasicHDU;

/**
 * Represents a single raw exposure (one FITS file from the instrument) while
 * it is being assessed.
 */
public class Exposure {

  /**
   * The file the exposure was read from.
   */
  private final Path path;

  /**
   * The primary header of the file. Validation steps read and modify this.
   */
  private final HeaderStore header;

  /**
   * The image segments of the exposure. A mosaic detector stores one segment
   * per image extension; a single-chip detector has one segment holding the
   * primary image.
   */
  private final List<Segment> segments = new ArrayList<Segment>();

  /**
   * The HDUs as read from the file, used when the archived copy is written.
   */
  private BasicHDU<?>[] hdus;

  /**
   * The number of HDUs that follow the primary HDU.
   */
  private int extensionCount;

  public Exposure(Path path, HeaderStore header) {
    if (path == null) {
      throw new IllegalArgumentException("Cannot create an exposure without the path of its file.");
    }
    this.path = path;
    this.header = (header == null) ? new HeaderStore() : header;
  }

  /**
   * The file the exposure was read from.
   * @return the path
   */
  public Path getPath() {
    return path;
  }

  /**
   * The name of the file the exposure was read from (without directories).
   * @return the file name
   */
  public String getFileName() {
    return path.getFileName().toString();
  }

  /**
   * The primary header of the file.
   * @return the header
   */
  public HeaderStore getHeader() {
    return header;
  }

  /**
   * The image segments of the exposure, in file order.
   * @return the segments
   */
  public List<Segment> getSegments() {
    return Collections.unmodifiableList(segments);
  }

  /**
   * Adds an image segment.
   * @param segment the segment to add
   */
  public void addSegment(Segment segment) {
    segments.add(segment);
  }

  /**
   * The HDUs as read from the file.
   * @return the hdus (may be null for exposures built in memory)
   */
  public BasicHDU<?>[] getHdus() {
    return hdus;
  }

  /**
   * The HDUs as read from the file.
   * @param hdus the hdus to set
   */
  public void setHdus(BasicHDU<?>[] hdus) {
    this.hdus = hdus;
  }

  /**
   * The number of HDUs that follow the primary HDU.
   * @return the extension count
   */
  public int getExtensionCount() {
    return extensionCount;
  }

  /**
   * The number of HDUs that follow the primary HDU.
   * @param extensionCount the extension count to set
   */
  public void setExtensionCount(int extensionCount) {
    this.extensionCount = extensionCount;
  }

  /**
   * The archive identifier assigned to the exposure, or null if none has
   * been assigned yet.
   * @return the identifier
   */
  public String getIdentifier() {
    return header.getString(HeaderStore.IDENTIFIER_KEYWORD);
  }
}
