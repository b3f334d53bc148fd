package io.crisisintel.coordination.common;

import java.util.List;
import java.util.function.Function;
import org.springframework.data.domain.Page;

/**
 * List envelope returned by every listing endpoint. {@code page} is 1-based.
 *
 * @param items the current page's items
 * @param page the 1-based page number
 * @param pageSize the page size in effect
 * @param total the total number of matching items
 * @param hasNext whether a further page exists
 */
public record PagedResponse<T>(
    List<T> items, int page, int pageSize, long total, boolean hasNext) {

  public static <E, T> PagedResponse<T> from(Page<E> page, Function<E, T> mapper) {
    return new PagedResponse<>(
        page.getContent().stream().map(mapper).toList(),
        page.getNumber() + 1,
        page.getSize(),
        page.getTotalElements(),
        page.hasNext());
  }
}
