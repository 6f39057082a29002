/*
 * Copyright 2026 The Skyproj Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.skyproj.geometry;

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.min;
import static java.lang.Math.sqrt;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import java.math.RoundingMode;

/**
 * The HEALPix equal-area pixelization of the sphere.
 *
 * <p>The sphere is divided into 12 base pixels, each subdivided into an nside x nside grid, giving
 * 12 * nside^2 pixels of equal area. Pixel ids may be numbered in {@link HealpixOrdering#RING} or
 * {@link HealpixOrdering#NESTED} order; the nested scheme needs nside to be a power of two.
 *
 * <p>Latitude runs from -90 (south pole) to 90 (north pole); pixel "z" below is the sine of the
 * latitude and "phi" the longitude in radians.
 */
public final class Healpix implements PixelScheme {
  /** The shared instance. The class is stateless. */
  public static final Healpix INSTANCE = new Healpix();

  /** The reserved value that marks a pixel without data in a dense map. */
  public static final double UNSEEN = -1.6375e30;

  /** The largest supported resolution, 2^29, keeps every pixel id within a long. */
  public static final int MAX_NSIDE = 1 << 29;

  private static final double HALF_PI = 0.5 * PI;
  private static final double TWO_THIRDS = 2.0 / 3.0;

  /** Ring index (in units of nside) of the northernmost corner of each base pixel. */
  private static final int[] JRLL = {2, 2, 2, 2, 3, 3, 3, 3, 4, 4, 4, 4};

  /** Longitude index (in units of pi/4) of the northernmost corner of each base pixel. */
  private static final int[] JPLL = {1, 3, 5, 7, 0, 2, 4, 6, 1, 3, 5, 7};

  private Healpix() {}

  @Override
  public long nsideToNpixel(int nside) {
    checkNside(nside);
    return 12L * nside * nside;
  }

  @Override
  public int npixelToNside(long npixel) {
    long nside = LongMath.sqrt(npixel / 12, RoundingMode.FLOOR);
    Preconditions.checkArgument(
        nside > 0 && 12 * nside * nside == npixel, "Invalid number of pixels: %s", npixel);
    return (int) nside;
  }

  /** Returns true if {@code nside} is a power of two, as the nested scheme requires. */
  public static boolean isNsideValidForNest(int nside) {
    return nside > 0 && (nside & (nside - 1)) == 0;
  }

  @Override
  public double maxPixelRadius(int nside) {
    checkNside(nside);
    // The largest pixels are those touching the equatorial / polar cap transition, whose center to
    // corner distance is between these two vectors.
    double[] va = fromZPhi(TWO_THIRDS, PI / (4.0 * nside));
    double t1 = 1.0 - 1.0 / nside;
    t1 *= t1;
    double[] vb = fromZPhi(1 - t1 / 3, 0);
    double cx = va[1] * vb[2] - va[2] * vb[1];
    double cy = va[2] * vb[0] - va[0] * vb[2];
    double cz = va[0] * vb[1] - va[1] * vb[0];
    double dot = va[0] * vb[0] + va[1] * vb[1] + va[2] * vb[2];
    return Math.toDegrees(Math.atan2(sqrt(cx * cx + cy * cy + cz * cz), dot));
  }

  @Override
  public long angleToPixel(int nside, double lon, double lat, HealpixOrdering ordering) {
    checkNside(nside, ordering);
    Preconditions.checkArgument(lat >= -90.0 && lat <= 90.0, "Latitude out of range: %s", lat);
    Preconditions.checkArgument(Double.isFinite(lon), "Longitude is not finite: %s", lon);
    double latRadians = Math.toRadians(lat);
    double z = Math.sin(latRadians);
    double sinTheta = Math.cos(latRadians);
    double tt = Platform.floorMod(Math.toRadians(lon) / HALF_PI, 4.0);
    return ordering == HealpixOrdering.RING
        ? zPhiToRing(nside, z, sinTheta, tt)
        : zPhiToNest(nside, z, sinTheta, tt);
  }

  @Override
  public LonLat pixelToAngle(int nside, long pixel, HealpixOrdering ordering) {
    checkNside(nside, ordering);
    long npix = 12L * nside * nside;
    Preconditions.checkArgument(pixel >= 0 && pixel < npix, "Pixel %s out of range", pixel);
    double[] zPhi =
        ordering == HealpixOrdering.RING ? ringToZPhi(nside, pixel) : nestToZPhi(nside, pixel);
    double lat = Math.toDegrees(Math.asin(SkyMath.clamp(zPhi[0], -1, 1)));
    return new LonLat(Math.toDegrees(zPhi[1]), lat);
  }

  private static long zPhiToRing(int nside, double z, double sinTheta, double tt) {
    double za = abs(z);
    long npix = 12L * nside * nside;
    long ncap = 2L * nside * (nside - 1);
    if (za <= TWO_THIRDS) {
      long nl4 = 4L * nside;
      double temp1 = nside * (0.5 + tt);
      double temp2 = nside * z * 0.75;
      // Indices of the ascending and descending edge lines.
      long jp = (long) (temp1 - temp2);
      long jm = (long) (temp1 + temp2);
      // Ring number counted from z = 2/3, in [1, 2 * nside + 1].
      long ir = nside + 1 + jp - jm;
      long kshift = 1 - (ir & 1);
      long t1 = jp + jm - nside + kshift + 1 + nl4 + nl4;
      long ip = (t1 >> 1) % nl4;
      return ncap + (ir - 1) * nl4 + ip;
    }
    double tp = tt - (long) tt;
    double tmp = polarScale(nside, za, sinTheta);
    long jp = (long) (tp * tmp);
    long jm = (long) ((1.0 - tp) * tmp);
    // Ring number counted from the closest pole.
    long ir = jp + jm + 1;
    long ip = min((long) (tt * ir), 4 * ir - 1);
    return z > 0 ? 2 * ir * (ir - 1) + ip : npix - 2 * ir * (ir + 1) + ip;
  }

  private static long zPhiToNest(int nside, double z, double sinTheta, double tt) {
    int order = Integer.numberOfTrailingZeros(nside);
    double za = abs(z);
    if (za <= TWO_THIRDS) {
      double temp1 = nside * (0.5 + tt);
      double temp2 = nside * (z * 0.75);
      long jp = (long) (temp1 - temp2);
      long jm = (long) (temp1 + temp2);
      long ifp = jp >> order;
      long ifm = jm >> order;
      int face;
      if (ifp == ifm) {
        face = (int) (ifp | 4);
      } else if (ifp < ifm) {
        face = (int) ifp;
      } else {
        face = (int) (ifm + 8);
      }
      long ix = jm & (nside - 1);
      long iy = nside - (jp & (nside - 1)) - 1;
      return xyfToNest(order, ix, iy, face);
    }
    int ntt = min(3, (int) tt);
    double tp = tt - ntt;
    double tmp = polarScale(nside, za, sinTheta);
    // Points too close to the boundary may round onto the next base pixel.
    long jp = min((long) (tp * tmp), nside - 1L);
    long jm = min((long) ((1.0 - tp) * tmp), nside - 1L);
    return z >= 0
        ? xyfToNest(order, nside - jm - 1, nside - jp - 1, ntt)
        : xyfToNest(order, jp, jm, ntt + 8);
  }

  /** Returns nside * sqrt(3 * (1 - |z|)), computed from sin(theta) near the poles for accuracy. */
  private static double polarScale(int nside, double za, double sinTheta) {
    return za < 0.99 ? nside * sqrt(3 * (1 - za)) : nside * sinTheta / sqrt((1.0 + za) / 3.0);
  }

  private static double[] ringToZPhi(int nside, long pixel) {
    long npix = 12L * nside * nside;
    long ncap = 2L * nside * (nside - 1);
    double fact2 = 4.0 / npix;
    double fact1 = (nside << 1) * fact2;
    if (pixel < ncap) {
      // North polar cap.
      long iring = (1 + LongMath.sqrt(1 + 2 * pixel, RoundingMode.FLOOR)) >> 1;
      long iphi = (pixel + 1) - 2 * iring * (iring - 1);
      return new double[] {1.0 - (iring * iring) * fact2, (iphi - 0.5) * HALF_PI / iring};
    } else if (pixel < npix - ncap) {
      long nl4 = 4L * nside;
      long ip = pixel - ncap;
      long tmp = ip / nl4;
      long iring = tmp + nside;
      long iphi = ip - nl4 * tmp + 1;
      double fodd = ((iring + nside) & 1) != 0 ? 1 : 0.5;
      return new double[] {(2L * nside - iring) * fact1, (iphi - fodd) * PI * 0.75 * fact1};
    } else {
      // South polar cap.
      long ip = npix - pixel;
      long iring = (1 + LongMath.sqrt(2 * ip - 1, RoundingMode.FLOOR)) >> 1;
      long iphi = 4 * iring + 1 - (ip - 2 * iring * (iring - 1));
      return new double[] {(iring * iring) * fact2 - 1.0, (iphi - 0.5) * HALF_PI / iring};
    }
  }

  private static double[] nestToZPhi(int nside, long pixel) {
    int order = Integer.numberOfTrailingZeros(nside);
    long npface = (long) nside * nside;
    int face = (int) (pixel >> (2 * order));
    long ipf = pixel & (npface - 1);
    long ix = compressBits(ipf);
    long iy = compressBits(ipf >> 1);

    long npix = 12L * nside * nside;
    double fact2 = 4.0 / npix;
    double fact1 = (nside << 1) * fact2;
    long nl4 = 4L * nside;
    long jr = ((long) JRLL[face] << order) - ix - iy - 1;
    long nr;
    double z;
    if (jr < nside) {
      nr = jr;
      z = 1 - (nr * nr) * fact2;
    } else if (jr > 3L * nside) {
      nr = nl4 - jr;
      z = (nr * nr) * fact2 - 1;
    } else {
      nr = nside;
      z = (2L * nside - jr) * fact1;
    }
    long tmp = JPLL[face] * nr + ix - iy;
    if (tmp < 0) {
      tmp += 8 * nr;
    }
    double phi = nr == nside ? 0.75 * HALF_PI * tmp * fact1 : (0.5 * HALF_PI * tmp) / nr;
    return new double[] {z, phi};
  }

  private static long xyfToNest(int order, long ix, long iy, int face) {
    return ((long) face << (2 * order)) + spreadBits(ix) + (spreadBits(iy) << 1);
  }

  /** Moves bit i of {@code v} to bit 2i of the result. */
  private static long spreadBits(long v) {
    long result = 0;
    for (int i = 0; i < 32 && (v >>> i) != 0; i++) {
      result |= ((v >>> i) & 1L) << (2 * i);
    }
    return result;
  }

  /** Inverse of {@link #spreadBits}: collects the even bits of {@code v}. */
  private static long compressBits(long v) {
    long result = 0;
    for (int i = 0; i < 32; i++) {
      result |= ((v >>> (2 * i)) & 1L) << i;
    }
    return result;
  }

  private static double[] fromZPhi(double z, double phi) {
    double sinTheta = sqrt((1.0 - z) * (1.0 + z));
    return new double[] {sinTheta * Math.cos(phi), sinTheta * Math.sin(phi), z};
  }

  private static void checkNside(int nside) {
    Preconditions.checkArgument(nside > 0 && nside <= MAX_NSIDE, "Invalid nside: %s", nside);
  }

  private static void checkNside(int nside, HealpixOrdering ordering) {
    checkNside(nside);
    if (ordering == HealpixOrdering.NESTED) {
      Preconditions.checkArgument(
          isNsideValidForNest(nside), "Nested ordering needs a power of 2 nside, got %s", nside);
    }
  }
}
