package optrace.instrumentation;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Descriptor of an argument of an instrumented call, carrying its shape when it has one. */
public final class InputValue {
  private static final long[] NO_SIZES = new long[0];
  private static final InputValue UNDEFINED_TENSOR =
      new InputValue(Type.UNDEFINED_TENSOR, NO_SIZES);
  private static final InputValue NON_TENSOR = new InputValue(Type.NON_TENSOR, NO_SIZES);

  public enum Type {
    TENSOR,
    UNDEFINED_TENSOR,
    NON_TENSOR
  }

  private final Type type;
  private final long[] sizes;

  private InputValue(Type type, long[] sizes) {
    this.type = type;
    this.sizes = sizes;
  }

  public static InputValue tensor(long... sizes) {
    return new InputValue(Type.TENSOR, sizes.clone());
  }

  public static InputValue undefinedTensor() {
    return UNDEFINED_TENSOR;
  }

  public static InputValue nonTensor() {
    return NON_TENSOR;
  }

  public Type type() {
    return this.type;
  }

  public boolean isTensor() {
    return this.type == Type.TENSOR;
  }

  /**
   * Returns the shape of the argument.
   *
   * @return the tensor sizes; empty for undefined tensors and non-tensor arguments.
   */
  public List<Long> shape() {
    if (this.sizes.length == 0) {
      return emptyList();
    }
    List<Long> shape = new ArrayList<>(this.sizes.length);
    for (long size : this.sizes) {
      shape.add(size);
    }
    return unmodifiableList(shape);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    InputValue that = (InputValue) o;
    return this.type == that.type && Arrays.equals(this.sizes, that.sizes);
  }

  @Override
  public int hashCode() {
    return 31 * this.type.hashCode() + Arrays.hashCode(this.sizes);
  }

  @Override
  public String toString() {
    return this.type == Type.TENSOR ? "Tensor" + Arrays.toString(this.sizes) : this.type.name();
  }
}
