package io.crisisintel.coordination.common;

import io.crisisintel.coordination.config.CoordinationProperties;
import io.crisisintel.coordination.exception.InvalidRequestException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/** Turns the {@code page}/{@code page_size} query parameters into a bounded {@link Pageable}. */
@Component
public class PageRequests {

  private final CoordinationProperties properties;

  public PageRequests(CoordinationProperties properties) {
    this.properties = properties;
  }

  public Pageable of(Integer page, Integer pageSize, Sort sort) {
    int number = page != null ? page : 1;
    if (number < 1) {
      throw new InvalidRequestException("Invalid page", "page must be 1 or greater");
    }
    int size = pageSize != null ? pageSize : properties.defaultPageSize();
    if (size < 1) {
      throw new InvalidRequestException("Invalid page size", "page_size must be 1 or greater");
    }
    return PageRequest.of(number - 1, Math.min(size, properties.maxPageSize()), sort);
  }

  /** Newest first by {@code createdAt}. */
  public Pageable newestFirst(Integer page, Integer pageSize) {
    return of(page, pageSize, Sort.by(Sort.Direction.DESC, "createdAt"));
  }
}
