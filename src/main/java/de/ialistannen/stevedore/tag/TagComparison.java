package de.ialistannen.stevedore.tag;

/**
 * The result of {@link ClassifiedTag#compare(ClassifiedTag)}. Either the two tags have an order, or they do not.
 */
public sealed interface TagComparison {

  /**
   * Returns the order of the two tags or throws if they were incomparable.
   *
   * @return -1, 0 or 1
   * @throws IncomparableTagException if the tags can not be compared
   */
  int orElseThrow();

  /**
   * @return true if the two tags had an order
   */
  boolean isOrdered();

  static TagComparison ordered(int result) {
    return new Ordered(Integer.signum(result));
  }

  static TagComparison incomparable(String reason) {
    return new Incomparable(new IncomparableTagException(reason));
  }

  record Ordered(int result) implements TagComparison {

    @Override
    public int orElseThrow() {
      return result;
    }

    @Override
    public boolean isOrdered() {
      return true;
    }
  }

  record Incomparable(IncomparableTagException reason) implements TagComparison {

    @Override
    public int orElseThrow() {
      throw reason;
    }

    @Override
    public boolean isOrdered() {
      return false;
    }
  }
}
