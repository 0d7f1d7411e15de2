package net.fabricspark.client.core;

/** The <code>kind</code> a statement is submitted with. */
public enum StatementKind {
  SQL("sql"),
  PYSPARK("pyspark");

  private final String kind;

  StatementKind(String kind) {
    this.kind = kind;
  }

  public String getKind() {
    return kind;
  }

  /**
   * @param language language name as used by callers
   * @return the matching kind, or null if the language is not supported
   */
  public static StatementKind fromLanguage(String language) {
    if (language != null) {
      for (StatementKind k : values()) {
        if (k.kind.equalsIgnoreCase(language.trim())) {
          return k;
        }
      }
    }
    return null;
  }
}
