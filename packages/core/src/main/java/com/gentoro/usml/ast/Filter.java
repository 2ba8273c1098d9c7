package com.gentoro.usml.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Binding of a request parameter to a WHERE clause, pagination, or sort order. */
public sealed interface Filter permits Filter.Where, Filter.Pagination, Filter.OrderBy {

  String param();

  FilterTarget mapsTo();

  /** {@code WHERE} condition containing {@code :name} placeholders. */
  record Where(String param, String condition) implements Filter {
    // "::" is a cast, not a placeholder
    private static final Pattern PLACEHOLDER =
        Pattern.compile("(?<![:A-Za-z0-9_]):([A-Za-z_][A-Za-z0-9_]*)");

    public Where {
      Objects.requireNonNull(param, "param");
      Objects.requireNonNull(condition, "condition");
    }

    @Override
    public FilterTarget mapsTo() {
      return FilterTarget.WHERE;
    }

    /** Placeholder names in order of first appearance. */
    public List<String> placeholders() {
      Set<String> names = new LinkedHashSet<>();
      Matcher m = PLACEHOLDER.matcher(condition);
      while (m.find()) {
        names.add(m.group(1));
      }
      return new ArrayList<>(names);
    }
  }

  record Pagination(
      String param,
      PaginationStrategy strategy,
      Integer pageSize,
      String limitParam,
      Integer maxPageSize,
      String cursorField)
      implements Filter {

    public Pagination {
      Objects.requireNonNull(param, "param");
      Objects.requireNonNull(strategy, "strategy");
    }

    @Override
    public FilterTarget mapsTo() {
      return FilterTarget.PAGINATION;
    }
  }

  record OrderBy(
      String param,
      String defaultColumn,
      SortDirection defaultDirection,
      Set<String> allowedColumns,
      Set<SortDirection> allowedDirections)
      implements Filter {

    public OrderBy {
      Objects.requireNonNull(param, "param");
      allowedColumns =
          allowedColumns == null
              ? null
              : Collections.unmodifiableSet(new LinkedHashSet<>(allowedColumns));
      allowedDirections =
          allowedDirections == null
              ? null
              : Collections.unmodifiableSet(new LinkedHashSet<>(allowedDirections));
    }

    @Override
    public FilterTarget mapsTo() {
      return FilterTarget.ORDER_BY;
    }
  }

  enum PaginationStrategy {
    OFFSET,
    CURSOR
  }

  enum SortDirection {
    ASC,
    DESC
  }
}
