/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.autoftir.modules.dataprocessing.ftir_agingindices;

import com.google.common.base.Preconditions;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.exceptions.FtirProcessingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Analyses many spectra in parallel, one task per spectrum. A spectrum that fails is logged and
 * reported in {@link #getErrors()}, the others are not affected.
 */
public class SpectrumBatchAnalysisTask implements Runnable {

  private static final Logger logger = Logger.getLogger(SpectrumBatchAnalysisTask.class.getName());

  public enum TaskStatus {
    WAITING, PROCESSING, FINISHED, CANCELED, ERROR
  }

  private final Map<String, Spectrum> spectra;
  private final FtirSpectrumAnalyzer analyzer;
  private final int threads;
  private final int totalItems;
  private final AtomicInteger processedItems = new AtomicInteger();
  private final Map<String, FtirAnalysisResult> results = new ConcurrentHashMap<>();
  private final Map<String, String> errors = new ConcurrentHashMap<>();
  private volatile TaskStatus status = TaskStatus.WAITING;
  private volatile String errorMessage;

  /**
   * @param spectra named spectra, for example by file name
   * @param threads number of worker threads
   */
  public SpectrumBatchAnalysisTask(@NotNull Map<String, Spectrum> spectra,
      @NotNull FtirAnalysisParameters parameters, int threads) {
    Preconditions.checkArgument(threads > 0, "Number of threads must be positive");
    this.spectra = new LinkedHashMap<>(spectra);
    this.analyzer = new FtirSpectrumAnalyzer(parameters);
    this.threads = threads;
    this.totalItems = spectra.size();
  }

  @Override
  public void run() {
    if (isCanceled()) {
      return;
    }
    status = TaskStatus.PROCESSING;
    logger.info(() -> "Started " + getTaskDescription());
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>(totalItems);
      for (Map.Entry<String, Spectrum> entry : spectra.entrySet()) {
        futures.add(executor.submit(() -> processSpectrum(entry.getKey(), entry.getValue())));
      }
      for (Future<?> future : futures) {
        future.get();
      }
      if (status == TaskStatus.PROCESSING) {
        status = TaskStatus.FINISHED;
      }
      logger.info(() -> "Finished %s, %d failed".formatted(getTaskDescription(),
          errors.size()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      status = TaskStatus.CANCELED;
    } catch (ExecutionException e) {
      error("Batch analysis failed: " + e.getCause().getMessage(), e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  private void processSpectrum(String name, Spectrum spectrum) {
    if (isCanceled()) {
      return;
    }
    try {
      final FtirAnalysisResult result = analyzer.analyze(spectrum);
      results.put(name, result);
      if (result.requiresReview()) {
        logger.info(() -> "Spectrum %s needs a manual check of %s".formatted(name,
            result.reviewGroups()));
      }
    } catch (FtirProcessingException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Analysis of spectrum " + name + " failed", e);
      errors.put(name, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    } finally {
      processedItems.incrementAndGet();
    }
  }

  private void error(String message, Throwable cause) {
    logger.log(Level.SEVERE, message, cause);
    errorMessage = message;
    status = TaskStatus.ERROR;
  }

  public void cancel() {
    if (status == TaskStatus.WAITING || status == TaskStatus.PROCESSING) {
      status = TaskStatus.CANCELED;
    }
  }

  public boolean isCanceled() {
    return status == TaskStatus.CANCELED;
  }

  public @NotNull TaskStatus getStatus() {
    return status;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getTaskDescription() {
    return "FTIR aging index analysis of %d spectra".formatted(totalItems);
  }

  public double getFinishedPercentage() {
    if (totalItems <= 0) {
      return 0;
    }
    return processedItems.get() / (double) totalItems;
  }

  /**
   * @return results of all successfully analysed spectra
   */
  public @NotNull Map<String, FtirAnalysisResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  /**
   * @return error message per failed spectrum
   */
  public @NotNull Map<String, String> getErrors() {
    return Collections.unmodifiableMap(errors);
  }
}
