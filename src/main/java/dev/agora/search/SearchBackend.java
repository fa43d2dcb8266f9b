package dev.agora.search;

/** An upstream search engine queried for every request. */
public interface SearchBackend {

  /** Engine name, as registered in the engine registry. */
  String name();

  /**
   * Runs the query against the engine.
   *
   * @param query the user's query
   * @return the engine's results, best first, and its page load time
   * @throws BackendException if the engine failed to answer
   */
  BackendResponse search(String query) throws BackendException;
}
