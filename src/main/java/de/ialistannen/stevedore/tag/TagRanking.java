package de.ialistannen.stevedore.tag;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A set of classified tags grouped by their {@link TagKind}. Orderable kinds are kept newest first.
 */
public class TagRanking {

  private final Map<TagKind, List<ClassifiedTag>> byKind;

  private TagRanking(Map<TagKind, List<ClassifiedTag>> byKind) {
    this.byKind = byKind;
  }

  /**
   * Groups the given tags by kind and sorts every orderable kind, newest first.
   *
   * @param tags the tags to rank
   * @return the ranking
   */
  public static TagRanking of(Collection<ClassifiedTag> tags) {
    Map<TagKind, List<ClassifiedTag>> byKind = new EnumMap<>(TagKind.class);
    for (ClassifiedTag tag : tags) {
      byKind.computeIfAbsent(tag.kind(), ignored -> new ArrayList<>()).add(tag);
    }

    Map<TagKind, List<ClassifiedTag>> sorted = new EnumMap<>(TagKind.class);
    for (Map.Entry<TagKind, List<ClassifiedTag>> entry : byKind.entrySet()) {
      List<ClassifiedTag> group = new ArrayList<>(entry.getValue());
      if (entry.getKey().isOrderable()) {
        group.sort(newestFirst());
      }
      sorted.put(entry.getKey(), ImmutableList.copyOf(group));
    }

    return new TagRanking(sorted);
  }

  /**
   * @param kind the kind to look up
   * @return all tags of the given kind. Newest first, if the kind is orderable
   */
  public List<ClassifiedTag> all(TagKind kind) {
    return byKind.getOrDefault(kind, List.of());
  }

  /**
   * @param kind the kind to look up
   * @param count the maximum amount of tags to return
   * @return the newest {@code count} tags of the given kind, newest first
   */
  public List<ClassifiedTag> newest(TagKind kind, int count) {
    return newest(kind, count, ignored -> true);
  }

  /**
   * @param kind the kind to look up
   * @param count the maximum amount of tags to return
   * @param filter only tags matching this filter are considered
   * @return the newest {@code count} tags of the given kind matching the filter, newest first
   */
  public List<ClassifiedTag> newest(TagKind kind, int count, Predicate<ClassifiedTag> filter) {
    return all(kind).stream()
      .filter(filter)
      .limit(Math.max(count, 0))
      .collect(ImmutableList.toImmutableList());
  }

  private static Comparator<ClassifiedTag> newestFirst() {
    // Tags whose numbers overflowed have no version. They are sorted last, by raw tag.
    // Equal versions (differing only in build metadata) are ordered by raw tag as well.
    Comparator<ClassifiedTag> ascending = (a, b) -> {
      TagComparison comparison = a.compare(b);
      if (comparison.isOrdered() && comparison.orElseThrow() != 0) {
        return comparison.orElseThrow();
      }
      if (a.semanticVersion().isPresent() != b.semanticVersion().isPresent()) {
        return a.semanticVersion().isPresent() ? 1 : -1;
      }
      return a.rawTag().compareTo(b.rawTag());
    };
    return ascending.reversed();
  }
}
