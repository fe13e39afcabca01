package com.consullo.cup.search;

/**
 * Search request. At least one of query, role, name or state must be set.
 *
 * @since 1.0
 */
public final class SearchQuery {

  public static final int DEFAULT_LIMIT = 5;

  private final String query;
  private final String role;
  private final String name;
  private final String state;
  private final int limit;

  private SearchQuery(Builder b) {
    this.query = b.query;
    this.role = b.role;
    this.name = b.name;
    this.state = b.state;
    this.limit = b.limit;
  }

  /**
   * Returns the freeform query such as "the submit button", or null.
   *
   * @return query or null
   */
  public String query() {
    return query;
  }

  /**
   * Returns the explicit role filter (canonical role or synonym), or null.
   *
   * @return role filter or null
   */
  public String role() {
    return role;
  }

  public String name() {
    return name;
  }

  /**
   * Returns the explicit canonical state filter, or null.
   *
   * @return state filter or null
   */
  public String state() {
    return state;
  }

  public int limit() {
    return limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "SearchQuery{query=" + query + ", role=" + role + ", name=" + name + ", state=" + state
        + ", limit=" + limit + "}";
  }

  public static final class Builder {

    private String query;
    private String role;
    private String name;
    private String state;
    private int limit = DEFAULT_LIMIT;

    private Builder() {
    }

    public Builder query(String query) {
      this.query = query;
      return this;
    }

    public Builder role(String role) {
      this.role = role;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder state(String state) {
      this.state = state;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public SearchQuery build() {
      return new SearchQuery(this);
    }
  }
}
