package funcstructs.core;

import com.google.common.math.BigIntegerMath;
import com.google.common.math.IntMath;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/** Elementary counting helpers shared by the cardinality formulas. */
public final class Counts {
  private Counts() {}

  public static BigInteger factorial(int n) {
    return BigIntegerMath.factorial(n);
  }

  /**
   * Number of multisets of size {@code r} drawn from {@code n} distinct items, i.e. {@code
   * C(n + r - 1, r)}.
   */
  public static BigInteger multichoose(BigInteger n, int r) {
    BigInteger value = BigInteger.ONE;
    for (int i = 1; i <= r; i++) {
      value = value.multiply(n.add(BigInteger.valueOf(r - i))).divide(BigInteger.valueOf(i));
    }
    return value;
  }

  /** {@code (sum parts)! / prod(part!)}. */
  public static BigInteger multinomial(int... parts) {
    int total = 0;
    BigInteger denominator = BigInteger.ONE;
    for (int part : parts) {
      total += part;
      denominator = denominator.multiply(BigIntegerMath.factorial(part));
    }
    return BigIntegerMath.factorial(total).divide(denominator);
  }

  /** Divisors of {@code n} in increasing order. */
  public static List<Integer> divisors(int n) {
    if (n < 1) {
      throw new InvalidParameterException("divisors require a positive integer, got " + n);
    }
    List<Integer> small = new ArrayList<>();
    List<Integer> large = new ArrayList<>();
    for (int d = 1; d <= n / d; d++) {
      if (n % d == 0) {
        small.add(d);
        if (d != n / d) {
          large.add(0, n / d);
        }
      }
    }
    small.addAll(large);
    return small;
  }

  public static int gcd(int... values) {
    int g = 0;
    for (int value : values) {
      g = IntMath.gcd(g, value);
    }
    return g;
  }

  /** Euler's totient: how many of {@code 1..n} are coprime to {@code n}. */
  public static int totient(int n) {
    if (n < 1) {
      throw new InvalidParameterException("totient requires a positive integer, got " + n);
    }
    int result = n;
    int rest = n;
    for (int p = 2; p <= rest / p; p++) {
      if (rest % p == 0) {
        while (rest % p == 0) {
          rest /= p;
        }
        result -= result / p;
      }
    }
    if (rest > 1) {
      result -= result / rest;
    }
    return result;
  }

  /** Product of two power series, keeping coefficients up to {@code degree}. */
  public static BigInteger[] multiply(BigInteger[] a, BigInteger[] b, int degree) {
    BigInteger[] product = new BigInteger[degree + 1];
    for (int k = 0; k <= degree; k++) {
      BigInteger sum = BigInteger.ZERO;
      for (int i = 0; i <= k; i++) {
        if (i < a.length && k - i < b.length) {
          sum = sum.add(a[i].multiply(b[k - i]));
        }
      }
      product[k] = sum;
    }
    return product;
  }
}
