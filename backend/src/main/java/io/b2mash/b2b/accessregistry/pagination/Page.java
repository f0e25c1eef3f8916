package io.b2mash.b2b.accessregistry.pagination;

import java.util.List;
import java.util.function.Function;

/** One page of a listing. {@code continuationToken} is null on the last page. */
public record Page<T>(List<T> items, String continuationToken) {

  public Page {
    items = List.copyOf(items);
  }

  public boolean hasNext() {
    return continuationToken != null;
  }

  public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
    return new Page<>(items.stream().<R>map(mapper).toList(), continuationToken);
  }
}
