/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.ftir_agingindices;

import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.ftir_agingindices.SpectrumBatchAnalysisTask.TaskStatus;
import io.github.autoftir.util.SyntheticSpectra;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumBatchAnalysisTaskTest {

  private static Map<String, Spectrum> batch() {
    final Spectrum binder = FtirSpectrumAnalyzerTest.driftingBinder();
    final double[] doubled = binder.getAbsorbances();
    for (int i = 0; i < doubled.length; i++) {
      doubled[i] *= 2;
    }
    final Map<String, Spectrum> spectra = new LinkedHashMap<>();
    spectra.put("binder_1", binder);
    spectra.put("binder_2", binder.withAbsorbances(doubled));
    spectra.put("blank", SyntheticSpectra.of());
    return spectra;
  }

  @Test
  void testBatch() {
    final SpectrumBatchAnalysisTask task = new SpectrumBatchAnalysisTask(batch(),
        FtirAnalysisParameters.defaults(), 2);
    Assertions.assertEquals(TaskStatus.WAITING, task.getStatus());
    Assertions.assertEquals("FTIR aging index analysis of 3 spectra", task.getTaskDescription());
    Assertions.assertEquals(0d, task.getFinishedPercentage());

    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    Assertions.assertEquals(1d, task.getFinishedPercentage());
    Assertions.assertEquals(Set.of("binder_1", "binder_2"), task.getResults().keySet());
    Assertions.assertEquals(Set.of("blank"), task.getErrors().keySet());
    Assertions.assertNull(task.getErrorMessage());

    final double beta1 = task.getResults().get("binder_1").getBeta();
    final double beta2 = task.getResults().get("binder_2").getBeta();
    Assertions.assertEquals(beta1 / 2, beta2, beta1 * 1e-6);
  }

  @Test
  void testCanceledBeforeStart() {
    final SpectrumBatchAnalysisTask task = new SpectrumBatchAnalysisTask(batch(),
        FtirAnalysisParameters.defaults(), 1);
    task.cancel();
    task.run();
    Assertions.assertEquals(TaskStatus.CANCELED, task.getStatus());
    Assertions.assertTrue(task.getResults().isEmpty());
    Assertions.assertTrue(task.getErrors().isEmpty());
  }

  @Test
  void testInvalidThreadCount() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SpectrumBatchAnalysisTask(Map.of(), FtirAnalysisParameters.defaults(), 0));
  }
}
