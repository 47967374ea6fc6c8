package p2m;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class CompilerOptions {
  public static final int DEFAULT_MAX_DEPTH = 256;

  // Maximum number of nested operation calls in one call graph.
  public abstract int maxDepth();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder().setMaxDepth(DEFAULT_MAX_DEPTH);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxDepth(int maxDepth);

    @ForOverride
    abstract CompilerOptions autoBuild();

    public final CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkArgument(options.maxDepth() >= 1, "maxDepth must be at least 1");
      return options;
    }
  }
}
