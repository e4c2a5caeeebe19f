package dev.scrapeproxy.fetch;

/** Fetches a page through the external fetch engine. */
public interface PageFetcher {

  /**
   * Fetch a single URL.
   *
   * @param url the URL to fetch
   * @param options per-request engine options
   * @return the fetched page; its final URL falls back to {@code url} when the engine reports none
   * @throws FetchException when the engine cannot be reached, times out or reports an error
   */
  FetchedPage fetch(String url, FetchOptions options);
}
