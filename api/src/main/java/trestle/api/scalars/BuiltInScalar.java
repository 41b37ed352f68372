package trestle.api.scalars;

/** The primitive scalars every schema has. */
public enum BuiltInScalar implements ScalarMarker {
  STRING("String"),
  INT("Int"),
  FLOAT("Float"),
  BOOLEAN("Boolean"),
  ID("ID");

  private final String graphQLName;

  BuiltInScalar(String graphQLName) {
    this.graphQLName = graphQLName;
  }

  public String graphQLName() {
    return graphQLName;
  }
}
