package io.windowstats.stats;

/**
 * Arithmetic a {@link Stat} needs from the type it aggregates. MEAN is computed in the same type,
 * so {@link #LONG} truncates like integer division.
 *
 * @param <T> boxed numeric type
 */
public interface NumericType<T extends Number> {

  NumericType<Long> LONG =
      new NumericType<>() {
        @Override
        public Long zero() {
          return 0L;
        }

        @Override
        public Long add(Long a, Long b) {
          return a + b;
        }

        @Override
        public int compare(Long a, Long b) {
          return Long.compare(a, b);
        }

        @Override
        public Long mean(Long sum, long count) {
          return sum / count;
        }

        @Override
        public Long fromCount(long count) {
          return count;
        }

        @Override
        public String toString() {
          return "LONG";
        }
      };

  NumericType<Double> DOUBLE =
      new NumericType<>() {
        @Override
        public Double zero() {
          return 0.0;
        }

        @Override
        public Double add(Double a, Double b) {
          return a + b;
        }

        @Override
        public int compare(Double a, Double b) {
          return Double.compare(a, b);
        }

        @Override
        public Double mean(Double sum, long count) {
          return sum / count;
        }

        @Override
        public Double fromCount(long count) {
          return (double) count;
        }

        @Override
        public String toString() {
          return "DOUBLE";
        }
      };

  T zero();

  T add(T a, T b);

  int compare(T a, T b);

  /** {@code sum / count}; only called with {@code count > 0}. */
  T mean(T sum, long count);

  T fromCount(long count);
}
