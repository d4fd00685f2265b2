/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * The pixels read out through one amplifier of the detector, together with
 * the header of the extension they were stored in.
 */
public class Segment {

  /**
   * The pixels of the segment, indexed [row][column].
   */
  private final int[][] pixels;

  /**
   * The header of the image extension holding this segment.
   */
  private final HeaderStore header;

  /**
   * The index of the HDU the segment was read from (0 for the primary HDU).
   */
  private final int extension;

  public Segment(int[][] pixels, HeaderStore header, int extension)
  {
    if (pixels == null)
    {
      throw new IllegalArgumentException("Cannot create a segment from a null pixel array.");
    }
    this.pixels = pixels;
    this.header = (header == null) ? new HeaderStore() : header;
    this.extension = extension;
  }

  /**
   * The pixels of the segment, indexed [row][column].
   * @return the pixels
   */
  public int[][] getPixels()
  {
    return pixels;
  }

  /**
   * The header of the image extension holding this segment.
   * @return the header
   */
  public HeaderStore getHeader()
  {
    return header;
  }

  public int getExtension()
  {
    return extension;
  }

  /**
   * The number of pixel rows in the segment.
   * @return the height
   */
  public int getHeight()
  {
    return pixels.length;
  }

  /**
   * The number of pixel columns in the segment.
   * @return the width
   */
  public int getWidth()
  {
    return pixels.length == 0 ? 0 : pixels[0].length;
  }

  /**
   * The raw detector section value of the segment (DETSEC), or null.
   * @return the detector section
   */
  public String getDetectorSection()
  {
    return header.getString("DETSEC");
  }

  /**
   * Parses the detector section of the segment.
   * @return the geometry of the segment within the mosaic.
   * @throws GeometryParseException if the segment has no usable DETSEC.
   */
  public SegmentGeometry getGeometry() throws GeometryParseException
  {
    return SegmentGeometry.parse(getDetectorSection());
  }
}
