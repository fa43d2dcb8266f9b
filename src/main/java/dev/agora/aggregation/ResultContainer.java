package dev.agora.aggregation;

import dev.agora.engine.EngineDescriptor;
import dev.agora.engine.EngineRegistry;
import dev.agora.metrics.AggregationMetrics;
import dev.agora.result.Answer;
import dev.agora.result.Correction;
import dev.agora.result.EngineDataEntry;
import dev.agora.result.Infobox;
import dev.agora.result.LegacyResult;
import dev.agora.result.MergedResult;
import dev.agora.result.NoUrlResult;
import dev.agora.result.RawResult;
import dev.agora.result.Result;
import dev.agora.result.ResultCountReport;
import dev.agora.result.Suggestion;
import dev.agora.result.Timing;
import dev.agora.result.UnresponsiveEngine;
import dev.agora.result.UrlResult;
import dev.agora.url.ParsedUrl;
import dev.agora.url.UrlComparator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the results of all engines queried for one search request and turns them into one
 * deduplicated, scored and ordered result list.
 *
 * <p>Lifecycle: created per request, fed concurrently by the engine workers through {@link
 * #extend}, {@link #addTiming} and {@link #addUnresponsiveEngine}, closed once when every engine
 * has finished or timed out, and read only afterwards. Mutations after {@link #close()} are
 * programming errors: they are logged and ignored rather than thrown, so a search degrades instead
 * of failing.
 *
 * <p>Every access to shared state happens under one lock. Classification, validation and the
 * {@link ResultFilter} run outside of it.
 */
public class ResultContainer {

  private static final Logger log = LoggerFactory.getLogger(ResultContainer.class);

  static final String INVALID_RESULTS_PREFIX = "some results are invalids: ";

  // Unicode-aware: no-break and other Unicode spaces count as whitespace
  private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
  private static final Pattern EDGE_WHITESPACE = Pattern.compile("(?U)^\\s+|\\s+\\z");

  private final EngineRegistry engineRegistry;
  private final AggregationMetrics metrics;
  private final ResultFilter resultFilter;
  private final ResultScorer scorer;
  private final InfoboxMerger infoboxMerger;
  private final ResultGrouper grouper;

  private final ReentrantLock lock = new ReentrantLock();

  private final List<MergedResult> mergedResults = new ArrayList<>();
  private List<UrlResult> orderedResults = List.of();
  private final List<Infobox> infoboxes = new ArrayList<>();
  private final Set<String> suggestions = new LinkedHashSet<>();
  private final Set<Answer> answers = new LinkedHashSet<>();
  private final Set<String> corrections = new LinkedHashSet<>();
  private final List<Long> numberOfResults = new ArrayList<>();
  private final Map<String, Map<String, String>> engineData = new LinkedHashMap<>();
  private final Set<UnresponsiveEngine> unresponsiveEngines = new LinkedHashSet<>();
  private final List<Timing> timings = new ArrayList<>();
  private volatile boolean closed;
  private volatile boolean paging;
  private volatile @Nullable String redirectUrl;

  public ResultContainer(
      EngineRegistry engineRegistry, AggregationMetrics metrics, ResultFilter resultFilter) {
    this.engineRegistry = engineRegistry;
    this.metrics = metrics;
    this.resultFilter = resultFilter;
    this.scorer = new ResultScorer(engineRegistry);
    this.infoboxMerger = new InfoboxMerger(engineRegistry);
    this.grouper = new ResultGrouper(engineRegistry);
  }

  /**
   * Adds the results of one engine, in the engine's rank order.
   *
   * @param engineName the engine, or null for internally synthesized results
   * @param results the engine's results, best first
   * @throws UnsupportedResultTypeException if a typed result has no ingestion route
   */
  public void extend(@Nullable String engineName, Iterable<? extends RawResult> results) {
    if (closed) {
      return;
    }

    int standardResultCount = 0;
    Set<String> errors = new LinkedHashSet<>();

    for (RawResult raw : results) {
      if (raw instanceof LegacyResult legacy) {
        Result result = LegacyResultClassifier.classify(legacy, engineName, errors);
        if (result != null && ingest(result, standardResultCount + 1)) {
          standardResultCount++;
        }
      } else if (raw instanceof Answer answer) {
        Answer attributed = answer.withDefaultEngine(engineName);
        if (resultFilter.accept(attributed)) {
          locked(() -> answers.add(attributed));
        }
      } else {
        throw new UnsupportedResultTypeException((Result) raw);
      }
    }

    for (String error : errors) {
      metrics.countError(engineName, INVALID_RESULTS_PREFIX + error, true);
    }

    EngineDescriptor engine = engineRegistry.find(engineName).orElse(null);
    if (engine != null) {
      metrics.observeResultCount(engine.name(), standardResultCount);
      if (engine.paging() && standardResultCount > 0) {
        paging = true;
      }
    }
  }

  /**
   * Routes one classified result to its bucket.
   *
   * @return true if a standard or no-URL result was taken, which consumes a position
   */
  private boolean ingest(Result result, int position) {
    switch (result.kind()) {
      case ANSWER -> {
        if (resultFilter.accept(result)) {
          locked(() -> answers.add((Answer) result));
        }
      }
      case SUGGESTION -> {
        if (resultFilter.accept(result)) {
          locked(() -> suggestions.add(((Suggestion) result).suggestion()));
        }
      }
      case CORRECTION -> {
        if (resultFilter.accept(result)) {
          locked(() -> corrections.add(((Correction) result).correction()));
        }
      }
      case INFOBOX -> locked(() -> insertInfobox((Infobox) result));
      case RESULT_COUNT ->
          locked(() -> numberOfResults.add(((ResultCountReport) result).numberOfResults()));
      case ENGINE_DATA -> {
        EngineDataEntry entry = (EngineDataEntry) result;
        locked(
            () ->
                engineData
                    .computeIfAbsent(entry.engine(), k -> new LinkedHashMap<>())
                    .put(entry.key(), entry.value()));
      }
      case URL_RESULT -> {
        if (resultFilter.accept(result)) {
          locked(() -> mergeUrlResult((UrlResult) result, position));
          return true;
        }
      }
      case NO_URL_RESULT -> {
        if (resultFilter.accept(result)) {
          NoUrlResult noUrl = (NoUrlResult) result;
          noUrl.initContribution(noUrl.engine(), position);
          locked(() -> mergedResults.add(noUrl));
          return true;
        }
      }
    }
    return false;
  }

  // callers hold the lock
  private void insertInfobox(Infobox infobox) {
    if (infobox.getId() != null) {
      ParsedUrl id = ParsedUrl.parse(infobox.getId());
      for (Infobox existing : infoboxes) {
        if (existing.getId() != null
            && UrlComparator.equivalent(ParsedUrl.parse(existing.getId()), id)) {
          infoboxMerger.merge(existing, infobox);
          return;
        }
      }
    }
    infoboxes.add(infobox);
  }

  // callers hold the lock
  private void mergeUrlResult(UrlResult result, int position) {
    UrlResult duplicate = findDuplicate(result);
    if (duplicate == null) {
      result.initContribution(result.engine(), position);
      mergedResults.add(result);
      return;
    }

    if (ContentLengthEstimator.estimate(result.getContent())
        > ContentLengthEstimator.estimate(duplicate.getContent())) {
      duplicate.setContent(result.getContent());
    }
    if (ContentLengthEstimator.estimate(result.getTitle())
        > ContentLengthEstimator.estimate(duplicate.getTitle())) {
      duplicate.setTitle(result.getTitle());
    }
    duplicate.absorbMissingFields(result);
    duplicate.addContribution(result.engine(), position);

    if (!duplicate.getParsedUrl().isSecure() && result.getParsedUrl().isSecure()) {
      duplicate.adoptUrl(result);
    }
  }

  /**
   * Same URL and same template make a duplicate; image results must also share the image source.
   */
  private @Nullable UrlResult findDuplicate(UrlResult result) {
    for (MergedResult merged : mergedResults) {
      if (!(merged instanceof UrlResult candidate)) {
        continue;
      }
      if (!UrlComparator.equivalent(result.getParsedUrl(), candidate.getParsedUrl())
          || !result.getTemplate().equals(candidate.getTemplate())) {
        continue;
      }
      if (!UrlResult.IMAGES_TEMPLATE.equals(result.getTemplate())) {
        return candidate;
      }
      if (imgSrcOf(result).equals(imgSrcOf(candidate))) {
        return candidate;
      }
    }
    return null;
  }

  private static String imgSrcOf(UrlResult result) {
    return result.getImgSrc() == null ? "" : result.getImgSrc();
  }

  /**
   * Scores, sorts and groups the merged results. Runs once; later calls are ignored. Every
   * contributing engine's score counter receives the result's score.
   */
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;

      for (MergedResult result : mergedResults) {
        double score = scorer.score(result, result.getPriority());
        result.setScore(score);
        if (!result.getContent().isEmpty()) {
          result.setContent(EDGE_WHITESPACE.matcher(result.getContent()).replaceAll(""));
        }
        if (!result.getTitle().isEmpty()) {
          result.setTitle(collapseWhitespace(result.getTitle()));
        }
        for (String engine : result.getEngines()) {
          metrics.addScore(engine, score);
        }
      }

      List<MergedResult> sorted = new ArrayList<>(mergedResults);
      // List.sort is stable: ties keep their arrival order
      sorted.sort(Comparator.comparingDouble(MergedResult::getScore).reversed());
      orderedResults = Collections.unmodifiableList(grouper.group(sorted));
    } finally {
      lock.unlock();
    }
  }

  private static String collapseWhitespace(String text) {
    String stripped = EDGE_WHITESPACE.matcher(text).replaceAll("");
    return stripped.isEmpty() ? stripped : WHITESPACE.matcher(stripped).replaceAll(" ");
  }

  /** Closes the container if needed and returns the results in display order. */
  public List<UrlResult> getOrderedResults() {
    close();
    return snapshot(() -> orderedResults);
  }

  /** Number of results: the display order once closed, the merged results before. */
  public int resultsLength() {
    lock.lock();
    try {
      return closed ? orderedResults.size() : mergedResults.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Average number of hits the engines claim to have. Returns 0 when no engine reported a count,
   * when called before {@link #close()}, or when the average is smaller than the number of results
   * actually shown, in which case the engines' claims are not credible.
   */
  public long numberOfResults() {
    lock.lock();
    try {
      if (!closed) {
        log.error("call to ResultContainer.numberOfResults before ResultContainer.close");
        return 0;
      }
      long sum = numberOfResults.stream().mapToLong(Long::longValue).sum();
      if (sum == 0 || numberOfResults.isEmpty()) {
        return 0;
      }
      long average = sum / numberOfResults.size();
      return average < resultsLength() ? 0 : average;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records an engine that failed to deliver. Engines configured to hide their errors are skipped.
   */
  public void addUnresponsiveEngine(String engineName, String errorType, boolean suspended) {
    lock.lock();
    try {
      if (closed) {
        log.error("call to ResultContainer.addUnresponsiveEngine after ResultContainer.close");
        return;
      }
      boolean display =
          engineRegistry
              .find(engineName)
              .map(EngineDescriptor::displayErrorMessages)
              .orElse(true);
      if (display) {
        unresponsiveEngines.add(new UnresponsiveEngine(engineName, errorType, suspended));
      }
    } finally {
      lock.unlock();
    }
  }

  public void addTiming(String engineName, Duration total, Duration load) {
    lock.lock();
    try {
      if (closed) {
        log.error("call to ResultContainer.addTiming after ResultContainer.close");
        return;
      }
      timings.add(new Timing(engineName, total, load));
    } finally {
      lock.unlock();
    }
  }

  /** Timings recorded so far; empty (and logged) when called before {@link #close()}. */
  public List<Timing> getTimings() {
    lock.lock();
    try {
      if (!closed) {
        log.error("call to ResultContainer.getTimings before ResultContainer.close");
        return List.of();
      }
      return List.copyOf(timings);
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /** True once an engine supporting paging contributed results. */
  public boolean isPaging() {
    return paging;
  }

  public @Nullable String getRedirectUrl() {
    return redirectUrl;
  }

  public void setRedirectUrl(@Nullable String redirectUrl) {
    this.redirectUrl = redirectUrl;
  }

  public List<Infobox> getInfoboxes() {
    return snapshot(() -> List.copyOf(infoboxes));
  }

  public Set<String> getSuggestions() {
    return snapshot(() -> Collections.unmodifiableSet(new LinkedHashSet<>(suggestions)));
  }

  public Set<Answer> getAnswers() {
    return snapshot(() -> Collections.unmodifiableSet(new LinkedHashSet<>(answers)));
  }

  public Set<String> getCorrections() {
    return snapshot(() -> Collections.unmodifiableSet(new LinkedHashSet<>(corrections)));
  }

  public Set<UnresponsiveEngine> getUnresponsiveEngines() {
    return snapshot(() -> Collections.unmodifiableSet(new LinkedHashSet<>(unresponsiveEngines)));
  }

  /** Engine data by engine name, then key. */
  public Map<String, Map<String, String>> getEngineData() {
    return snapshot(
        () -> {
          Map<String, Map<String, String>> copy = new LinkedHashMap<>();
          engineData.forEach((engine, data) -> copy.put(engine, Map.copyOf(data)));
          return Collections.unmodifiableMap(copy);
        });
  }

  private void locked(Runnable action) {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      action.run();
    } finally {
      lock.unlock();
    }
  }

  private <T> T snapshot(Supplier<T> reader) {
    lock.lock();
    try {
      return reader.get();
    } finally {
      lock.unlock();
    }
  }
}
