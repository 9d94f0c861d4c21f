package roptim.util;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import java.util.function.Function;

/** Either S or T, never both. */
public final class Either<S, T> {
  public final Optional<S> s;
  public final Optional<T> t;

  private Either(Optional<S> s, Optional<T> t) {
    this.s = s;
    this.t = t;
  }

  public static <S, T> Either<S, T> left(S s) {
    return new Either<>(Optional.of(checkNotNull(s)), Optional.empty());
  }

  public static <S, T> Either<S, T> right(T t) {
    return new Either<>(Optional.empty(), Optional.of(checkNotNull(t)));
  }

  public <R> R fold(Function<? super S, ? extends R> ifS, Function<? super T, ? extends R> ifT) {
    return s.isPresent() ? ifS.apply(s.get()) : ifT.apply(t.get());
  }

  @Override
  public String toString() {
    return s.isPresent() ? "Left(" + s.get() + ")" : "Right(" + t.get() + ")";
  }
}
