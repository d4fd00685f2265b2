/*
* Copyright 2007-2010 The Authors (see AUTHORS)
* This file is part of Arotake, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

/*******************************************************************************
*  File      : FitsFiles.java
*
*  Overview
*  --------
*
*    The FitsFiles class converts between FITS files on disk and Exposure
*  objects: it loads the headers and pixel arrays of every HDU, and writes
*  the archived (level 0) copy of an exposure with its repaired header.
*
*******************************************************************************/

package arotake;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.fits.ImageHDU;
import nom.tam.util.Cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FitsFiles
{
  private static final Logger logger = LoggerFactory.getLogger(FitsFiles.class);

  /**
   * The longest string value that fits on a single header card.
   */
  static final int MAX_STRING_LENGTH = 68;

  public FitsFiles()
  {
  }

  //***************************************************************************
  /**
   * Loads the named FITS file from disk, reading the primary header and the
   * pixels of every two-dimensional image HDU.
   * @param file - the FITS file on disk to load.
   * @return the loaded exposure.
   * @throws java.io.IOException if there was a problem loading the file.
   */
  public Exposure load(Path file) throws IOException
  {
    if (file == null)
    {
      throw new IllegalArgumentException("Cannot load a FITS file as the path provided is null.");
    }

    InputStream stream = new BufferedInputStream(new FileInputStream(file.toFile()));
    try
    {
      Fits fits = new Fits(stream);
      BasicHDU<?>[] hdus = fits.read();
      if (hdus == null || hdus.length == 0)
      {
        throw new IOException("The FITS file '" + file + "' contains no HDUs.");
      }

      HeaderStore primary = readHeader(hdus[0].getHeader());
      Exposure exposure = new Exposure(file, primary);
      exposure.setHdus(hdus);
      exposure.setExtensionCount(hdus.length - 1);

      for (int index = 0; index < hdus.length; ++index)
      {
        BasicHDU<?> hdu = hdus[index];
        if (!(hdu instanceof ImageHDU))
        {
          continue;
        }
        int[] axes = hdu.getAxes();
        if (axes == null || axes.length != 2)
        {
          continue;
        }
        HeaderStore header = (index == 0) ? primary : readHeader(hdu.getHeader());
        exposure.addSegment(new Segment(toPixels(hdu), header, index));
      }

      logger.debug("Loaded {} with {} extensions and {} image segments", file, exposure.getExtensionCount(),
                   exposure.getSegments().size());
      return exposure;
    }
    catch (FitsException ex)
    {
      throw new IOException("Unable to load the FITS file called '" + file + "'", ex);
    }
    finally
    {
      stream.close();
    }
  }

  //***************************************************************************
  /**
   * Copies the keyword cards of a FITS header into a header store. Comment,
   * history and blank cards are not copied.
   */
  public static HeaderStore readHeader(Header header)
  {
    HeaderStore store = new HeaderStore();
    Cursor<String, HeaderCard> cursor = header.iterator();
    while (cursor.hasNext())
    {
      HeaderCard card = cursor.next();
      if (!card.isKeyValuePair())
      {
        continue;
      }
      store.load(card.getKey(), interpretValue(card), card.getComment());
    }
    return store;
  }

  // Converts a card's value to the most specific type it holds.
  static Object interpretValue(HeaderCard card)
  {
    String raw = card.getValue();
    if (raw == null)
    {
      return null;
    }
    if (card.isStringValue())
    {
      return raw;
    }

    String trimmed = raw.trim();
    if (trimmed.equals("T"))
    {
      return Boolean.TRUE;
    }
    if (trimmed.equals("F"))
    {
      return Boolean.FALSE;
    }
    try
    {
      return Long.valueOf(trimmed);
    }
    catch (NumberFormatException ex)
    {
      // Not an integer, try a real value next.
    }
    try
    {
      return Double.valueOf(trimmed.replace('D', 'E').replace('d', 'e'));
    }
    catch (NumberFormatException ex)
    {
      return trimmed;
    }
  }

  //***************************************************************************
  /**
   * Returns the pixel contents of an image HDU as a two-dimensional array of
   * intensity values, with BZERO and BSCALE applied.
   * @throws java.io.IOException if the pixel type is not supported.
   * @throws nom.tam.fits.FitsException if the pixel data cannot be read.
   */
  public static int[][] toPixels(BasicHDU<?> hdu) throws IOException, FitsException
  {
    final double bscale = hdu.getBScale();
    final double bzero = hdu.getBZero();
    final int pixelType = hdu.getBitPix();
    final Object kernel = hdu.getKernel();
    if (kernel == null)
    {
      throw new IOException("The image HDU has no pixel data.");
    }

    switch (pixelType)
    {
      case BasicHDU.BITPIX_BYTE:
      {
        byte[][] values = (byte[][]) kernel;
        int[][] pixels = new int[values.length][];
        for (int row = 0; row < values.length; ++row)
        {
          pixels[row] = new int[values[row].length];
          for (int column = 0; column < values[row].length; ++column)
          {
            // FITS bytes are unsigned.
            pixels[row][column] = (int) (bzero + bscale * (values[row][column] & 0xff));
          }
        }
        return pixels;
      }

      case BasicHDU.BITPIX_SHORT:
      {
        short[][] values = (short[][]) kernel;
        int[][] pixels = new int[values.length][];
        for (int row = 0; row < values.length; ++row)
        {
          pixels[row] = new int[values[row].length];
          for (int column = 0; column < values[row].length; ++column)
          {
            pixels[row][column] = (int) (bzero + bscale * values[row][column]);
          }
        }
        return pixels;
      }

      case BasicHDU.BITPIX_INT:
      {
        int[][] values = (int[][]) kernel;
        int[][] pixels = new int[values.length][];
        for (int row = 0; row < values.length; ++row)
        {
          pixels[row] = new int[values[row].length];
          for (int column = 0; column < values[row].length; ++column)
          {
            pixels[row][column] = (int) (bzero + bscale * values[row][column]);
          }
        }
        return pixels;
      }

      case BasicHDU.BITPIX_FLOAT:
      {
        float[][] values = (float[][]) kernel;
        int[][] pixels = new int[values.length][];
        for (int row = 0; row < values.length; ++row)
        {
          pixels[row] = new int[values[row].length];
          for (int column = 0; column < values[row].length; ++column)
          {
            pixels[row][column] = (int) (bzero + bscale * values[row][column]);
          }
        }
        return pixels;
      }

      case BasicHDU.BITPIX_DOUBLE:
      {
        double[][] values = (double[][]) kernel;
        int[][] pixels = new int[values.length][];
        for (int row = 0; row < values.length; ++row)
        {
          pixels[row] = new int[values[row].length];
          for (int column = 0; column < values[row].length; ++column)
          {
            pixels[row][column] = (int) (bzero + bscale * values[row][column]);
          }
        }
        return pixels;
      }

      default:
        throw new IOException("Pixel type is not yet supported (BITPIX = " + pixelType + ").");
    }
  }

  //***************************************************************************
  /**
   * Writes the archived copy of an exposure: the HDUs as they were read, with
   * every keyword set during validation written into the primary header.
   * @param exposure - the exposure to write.
   * @param target - the file to write (replaced if it exists).
   * @throws java.io.IOException if the file cannot be written.
   */
  public void writeLevel0(Exposure exposure, Path target) throws IOException
  {
    BasicHDU<?>[] hdus = exposure.getHdus();
    if (hdus == null || hdus.length == 0)
    {
      throw new IOException("Cannot write " + target + " as the exposure has no HDUs.");
    }

    try
    {
      Header primary = hdus[0].getHeader();
      for (HeaderStore.Entry entry : exposure.getHeader().getModifiedEntries())
      {
        addCard(primary, entry);
      }

      Fits fits = new Fits();
      for (BasicHDU<?> hdu : hdus)
      {
        fits.addHDU(hdu);
      }
      write(fits, target);
    }
    catch (FitsException ex)
    {
      throw new IOException("Unable to write the FITS file called '" + target + "'", ex);
    }
    logger.info("Wrote {}", target);
  }

  //***************************************************************************
  /**
   * Saves pixels to disk as a single-HDU FITS image with the given header
   * keywords.
   */
  public static void saveImage(Path target, HeaderStore header, int[][] pixels) throws IOException
  {
    if (pixels == null)
    {
      throw new IllegalArgumentException("Cannot save the image as the pixel array was null.");
    }
    try
    {
      Fits image = new Fits();
      BasicHDU<?> hdu = Fits.makeHDU(pixels);
      if (header != null)
      {
        for (HeaderStore.Entry entry : header)
        {
          addCard(hdu.getHeader(), entry);
        }
      }
      image.addHDU(hdu);
      write(image, target);
    }
    catch (FitsException ex)
    {
      throw new IOException("Unable to write the FITS file called '" + target + "'", ex);
    }
  }

  private static void write(Fits fits, Path target) throws IOException, FitsException
  {
    DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(target.toFile())));
    try
    {
      fits.write(dos);
    }
    finally
    {
      dos.close();
    }
  }

  // Adds or replaces one keyword card in a FITS header.
  static void addCard(Header header, HeaderStore.Entry entry) throws FitsException
  {
    String key = entry.getKeyword();
    Object value = entry.getValue();
    String comment = entry.getComment();

    if (value instanceof Boolean)
    {
      header.addValue(key, ((Boolean) value).booleanValue(), comment);
    }
    else if (value instanceof Long || value instanceof Integer)
    {
      header.addValue(key, ((Number) value).longValue(), comment);
    }
    else if (value instanceof Number)
    {
      header.addValue(key, ((Number) value).doubleValue(), comment);
    }
    else if (value != null)
    {
      String text = value.toString();
      if (text.length() > MAX_STRING_LENGTH)
      {
        text = text.substring(0, MAX_STRING_LENGTH);
      }
      header.addValue(key, text, comment);
    }
    else
    {
      logger.debug("Not writing {} as it has no value", key);
    }
  }
}
