package SymDFA.Codec;

import java.math.BigInteger;
import java.util.BitSet;

import SymDFA.Model.MalformedEncodingException;

/**
 * Growable sequence of bits with a read cursor. Bit 0 is the first bit written, which becomes the most
 * significant bit of {@link #toBigInteger()}.
 * Writes always go to the end; reads consume from the cursor onwards.
 */
public final class BitBuffer {
  private final BitSet bits;
  private int length;
  private int position;

  public BitBuffer() {
    this.bits = new BitSet();
  }

  private BitBuffer(BitSet bits, int length) {
    this.bits = bits;
    this.length = length;
  }

  /**
   * Bits of a positive integer, most significant first. The leading bit is therefore always 1.
   */
  public static BitBuffer fromBigInteger(BigInteger value) {
    if (value.signum() <= 0) {
      throw new MalformedEncodingException("Not a positive integer: " + value);
    }
    final int length = value.bitLength();
    final BitSet bits = new BitSet(length);
    for (int i = 0; i < length; i++) {
      if (value.testBit(length - 1 - i)) {
        bits.set(i);
      }
    }
    return new BitBuffer(bits, length);
  }

  public void appendBit(boolean bit) {
    bits.set(length++, bit);
  }

  /**
   * Append the low width bits of value, most significant first.
   */
  public void appendBits(long value, int width) {
    if (width < 0 || width > 63) {
      throw new IllegalArgumentException("width out of range: " + width);
    }
    if (value < 0 || (value >>> width) != 0) {
      throw new IllegalArgumentException(value + " does not fit in " + width + " bits");
    }
    for (int k = width - 1; k >= 0; k--) {
      appendBit(((value >>> k) & 1L) != 0);
    }
  }

  /**
   * Append count 1-bits terminated by a 0-bit.
   */
  public void appendUnary(int count) {
    for (int k = 0; k < count; k++) {
      appendBit(true);
    }
    appendBit(false);
  }

  public boolean readBit() {
    require(1);
    return bits.get(position++);
  }

  public long readBits(int width) {
    if (width < 0 || width > 63) {
      throw new IllegalArgumentException("width out of range: " + width);
    }
    require(width);
    long value = 0;
    for (int k = 0; k < width; k++) {
      value = (value << 1) | (bits.get(position++) ? 1L : 0L);
    }
    return value;
  }

  /**
   * Number of 1-bits between the cursor and the next 0-bit, or -1 if no 0-bit remains.
   */
  public int findFirstZero() {
    int zero = bits.nextClearBit(position);
    return zero < length ? zero - position : -1;
  }

  /**
   * Consume a unary count written by {@link #appendUnary(int)}.
   */
  public int readUnary() {
    int count = findFirstZero();
    if (count < 0) {
      throw new MalformedEncodingException("Unterminated unary field at bit " + position);
    }
    position += count + 1;
    return count;
  }

  public int length() {
    return length;
  }

  public int remaining() {
    return length - position;
  }

  private void require(int width) {
    if (remaining() < width) {
      throw new MalformedEncodingException(
          "Expected " + width + " more bits at bit " + position + ", only " + remaining() + " remain");
    }
  }

  public BigInteger toBigInteger() {
    final byte[] magnitude = new byte[(length + 7) / 8];
    for (int i = bits.nextSetBit(0); i >= 0 && i < length; i = bits.nextSetBit(i + 1)) {
      int p = length - 1 - i; // place value of bit i
      magnitude[magnitude.length - 1 - (p >> 3)] |= (byte) (1 << (p & 7));
    }
    return new BigInteger(1, magnitude);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(bits.get(i) ? '1' : '0');
    }
    return sb.toString();
  }
}
