package com.gentoro.usml.ast;

import java.util.List;

/**
 * One entry of {@code response_mapping}. Scalars read a single column; arrays name the table that
 * produces each element and own the per-element mapping in {@link ArrayMapping#children()}.
 * Trees are strictly hierarchical and nest to arbitrary depth.
 */
public sealed interface MappingNode permits ScalarMapping, ArrayMapping {

  String field();

  MappingKind kind();

  /** Primary join, or null. */
  JoinSpec join();

  List<JoinLink> joinChain();

  /** Aggregation, or null. */
  AggregateSpec aggregate();

  default boolean hasJoin() {
    return join() != null;
  }

  default boolean hasJoinChain() {
    return !joinChain().isEmpty();
  }

  default boolean hasAggregate() {
    return aggregate() != null;
  }

  /** Table produced by the join: the last chain link when present, else the primary join. */
  default String joinTailTable() {
    if (join() == null) {
      return null;
    }
    List<JoinLink> chain = joinChain();
    return chain.isEmpty() ? join().table() : chain.get(chain.size() - 1).table();
  }

  /** Binding name (alias or table) of {@link #joinTailTable()}. */
  default String joinTailBinding() {
    if (join() == null) {
      return null;
    }
    List<JoinLink> chain = joinChain();
    return chain.isEmpty() ? join().bindingName() : chain.get(chain.size() - 1).bindingName();
  }
}
