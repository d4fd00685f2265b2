/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.HeaderStore;
import arotake.IdentifierGenerator;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Assigns the archive identifier (KOAID) from the instrument prefix and the
 * DATE-OBS and UTC of the exposure. An identifier already in the header is
 * kept.
 */
public class SetIdentifier extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetIdentifier.class);

    private final IdentifierGenerator generator;

    public SetIdentifier() {
        this(new IdentifierGenerator());
    }

    public SetIdentifier(IdentifierGenerator generator) {
        super("set_koaid");
        this.generator = generator;
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        String fileName = context.getExposure().getFileName();

        if (header.getString(HeaderStore.IDENTIFIER_KEYWORD, "").trim().length() > 0) {
            return true;
        }

        String prefix = context.getProfile().getIdentifierPrefix(header);
        if (prefix == null || prefix.length() == 0) {
            logger.error("{}: no identifier prefix applies to this file", fileName);
            return false;
        }

        String identifier;
        try {
            identifier = generator.generate(prefix, header.getString("DATE-OBS"), header.getString("UTC"));
        } catch (IllegalArgumentException ex) {
            logger.error("{}: cannot create identifier: {}", fileName, ex.getMessage());
            return false;
        }

        logger.info("{}: KOAID = {}", fileName, identifier);
        header.set(HeaderStore.IDENTIFIER_KEYWORD, identifier, "KOA: Data file name");
        return true;
    }
}
