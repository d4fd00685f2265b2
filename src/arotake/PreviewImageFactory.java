/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

/**
*    The PreviewImageFactory turns exposure data into greyscale preview
*  images. A reconstructed mosaic arrives already stretched into [0,1] and is
*  mapped linearly onto the colourmap. A single frame is rendered using
*  'histogram equalisation', where all the grey levels occur with nearly
*  equal frequency (producing good contrast between different values in the
*  input data array).
*
*    The first row of the data is drawn at the bottom of the image, as
*  astronomical images are displayed.
*/
public class PreviewImageFactory
{
  int    numBins;     // Number of pixel intensity bins to use.
  double lowestLevel; // Lowest intensity level (bottom of lowest bin).
  double binWidth;    // Width of an intensity bin.

  int[] equalisationTable; // Table mapping pixel intensity level to colourmap index.

  int[] colourmap;         // RGB colourmap.
  int maxComponent;        // maximum colour index.

  //*******************************************************************
  /**
   * Constructs a PreviewImageFactory object which produces greyscale
   * images.
   */
  public PreviewImageFactory()
  {
    numBins = 100001; // use this many intensity bins.
    maxComponent = 256;

    loadColourmapGrey();
  }

  //*******************************************************************
  /**
   * Renders a normalised image whose values lie in [0,1]. Values outside
   * that range are clipped.
   */
  public BufferedImage renderNormalised(double[][] data)
  {
    checkRectangular(data);

    int numrows = data.length;
    int numcolumns = data[0].length;
    BufferedImage image = new BufferedImage(numcolumns, numrows, BufferedImage.TYPE_INT_RGB);

    for (int row = 0; row < numrows; ++row)
    {
      for (int column = 0; column < numcolumns; ++column)
      {
        double value = Math.max(0.0, Math.min(1.0, data[row][column]));
        int index = (int) Math.round(value * (maxComponent - 1));
        image.setRGB(column, numrows - row - 1, colourmap[index]); // nb. reverse image in y-direction.
      }
    }

    return image;
  }

  //*******************************************************************
  /**
   * Renders the first image segment of an exposure with histogram
   * equalisation. This is used for single-chip detectors and whenever a
   * mosaic cannot be reconstructed.
   * @throws java.io.IOException if the exposure holds no image data.
   */
  public BufferedImage renderSingleFrame(Exposure exposure) throws IOException
  {
    if (exposure.getSegments().isEmpty())
    {
      throw new IOException("Cannot render a preview of " + exposure.getFileName() + " as it has no image data.");
    }
    return renderEqualised(exposure.getSegments().get(0).getPixels());
  }

  //*******************************************************************
  // Draws pixels into an image buffer after histogram equalisation.
  public BufferedImage renderEqualised(int[][] data)
  {
    if (data == null)
    {
      throw new IllegalArgumentException("Cannot generate an image if the source data array is null");
    }

    double[][] values = new double[data.length][];
    for (int row = 0; row < data.length; ++row)
    {
      values[row] = new double[data[row].length];
      for (int column = 0; column < data[row].length; ++column)
      {
        values[row][column] = data[row][column];
      }
    }
    return renderEqualised(values);
  }

  //*******************************************************************
  // Draws pixels into an image buffer after histogram equalisation.
  public BufferedImage renderEqualised(double[][] data)
  {
    intensityEqualise(data);

    int numrows = data.length;
    int numcolumns = data[0].length;
    BufferedImage image = new BufferedImage(numcolumns, numrows, BufferedImage.TYPE_INT_RGB);

    for (int row = 0; row < numrows; ++row)
    {
      for (int column = 0; column < numcolumns; ++column)
      {
        // Convert the intensity to a colour using the colourmap and store
        // in the destination image.
        int pixel = colourmap[equalisationTable[binOf(data[row][column])]];
        image.setRGB(column, numrows - row - 1, pixel);
      }
    }

    return image;
  }

  //*******************************************************************
  /**
   * Writes an image to disk as a JPEG file.
   * @throws java.io.IOException if the file cannot be written.
   */
  public void writeJpeg(BufferedImage image, Path target) throws IOException
  {
    if (image == null)
    {
      throw new IllegalArgumentException("Cannot write a null image to " + target);
    }
    if (!ImageIO.write(image, "jpg", target.toFile()))
    {
      throw new IOException("No JPEG writer is available to write " + target);
    }
  }

  // Determines which bin an intensity belongs within.
  int binOf(double intensity)
  {
    int binNumber = (int) Math.floor((intensity - lowestLevel) / binWidth);
    return Math.max(0, Math.min(numBins - 1, binNumber));
  }

  static void checkRectangular(double[][] data)
  {
    if (data == null)
    {
      throw new IllegalArgumentException("Cannot generate an image if the source data array is null");
    }

    final int numRows = data.length;
    if (numRows <= 0)
    {
      throw new IllegalArgumentException("Cannot generate an image as the input data array has " + numRows + " rows.");
    }

    final int numColumns = data[0].length;
    if (numColumns <= 0)
    {
      throw new IllegalArgumentException("Cannot generate an image as the input data array has " + numColumns + " columns.");
    }

    for (int row = 0; row < numRows; ++row)
    {
      if (data[row].length != numColumns)
      {
        throw new IllegalArgumentException("Cannot generate an image as the input data array has "
                                           + data[row].length + " columns in row " + row + " when " + numColumns + " columns were expected.");
      }
    }
  }

  //****************************************************************************
  // Computes the mapping between pixel intensity values and display colour
  // map indices. This is used so that contrast is enhanced. The technique
  // implemented in this method is called histogram equalisation.
  void intensityEqualise(double[][] data)
  {
    checkRectangular(data);

    final int numRows = data.length;
    final int numColumns = data[0].length;

    // Determine the range of intensity values.
    double minValue = Double.MAX_VALUE;
    double maxValue = -Double.MAX_VALUE;

    for (int row = 0; row < numRows; ++row)
    {
      for (int column = 0; column < numColumns; ++column)
      {
        double value = data[row][column];
        if (value > maxValue)
        {
          maxValue = value;
        }
        if (value < minValue)
        {
          minValue = value;
        }
      }
    }

    // A flat image still needs a non-zero bin width.
    final double range = Math.max(maxValue - minValue, 1.0);
    final int logRange = (int) Math.ceil(Math.log(range) / Math.log(10.0)); // power-of-10 that covers the range.

    // Determine the lowest intensity value of the lowest bin and the width of
    // the bins.
    binWidth = (Math.pow(10.0, logRange) / (numBins - 1.0));
    if (minValue >= 0)
      lowestLevel = binWidth * Math.floor(minValue / binWidth);
    else
      lowestLevel = -binWidth * Math.ceil(Math.abs(minValue / binWidth));

    // Find the frequency of intensities within each bin.
    int[] frequencies = new int[numBins];
    for (int row = 0; row < numRows; ++row)
    {
      for (int column = 0; column < numColumns; ++column)
      {
        ++frequencies[binOf(data[row][column])];
      }
    }

    // This code does intensity histogram equalisation.
    long numPixels = (long) numRows * numColumns;
    double scalingFactor = (maxComponent - 1.0) / (double) numPixels;
    long cumulative = 0;

    equalisationTable = new int[numBins];

    for (int count = 0; count < numBins; ++count)
    {
      cumulative += frequencies[count];
      // Store the mapping between the pixel value and equalised colourmap
      // index to use.
      equalisationTable[count] = (int) Math.floor(cumulative * scalingFactor);
    }
  }

  //****************************************************************************
  //
  public void loadColourmapGrey()
  {
    colourmap = new int[maxComponent];

    for (int index = 0; index < maxComponent; ++index)
    {
      int red = index;
      int green = index;
      int blue = index;

      colourmap[index] = ((red & 0xff) << 16) | ((green & 0xff) << 8) | (blue & 0xff);
    }
  }
}
