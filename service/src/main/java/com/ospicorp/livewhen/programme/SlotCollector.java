package com.ospicorp.livewhen.programme;

import com.ospicorp.livewhen.common.InsufficientDataException;
import com.ospicorp.livewhen.common.NotFoundException;
import com.ospicorp.livewhen.common.StoreFailureException;
import com.ospicorp.livewhen.heatmap.HeatmapService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Predicted slots of one streamer inside a batch programme. A streamer that cannot be predicted
 * is left out instead of failing the whole programme; a cancelled store call still aborts it.
 */
@Component
public class SlotCollector {
  private static final Logger log = LoggerFactory.getLogger(SlotCollector.class);

  private final HeatmapService heatmapService;

  public SlotCollector(HeatmapService heatmapService) {
    this.heatmapService = heatmapService;
  }

  public Optional<List<ProgrammeEntry>> collect(String streamerId) {
    try {
      return Optional.of(ProgrammeSlots.slots(heatmapService.generateHeatmap(streamerId)));
    } catch (InsufficientDataException ex) {
      log.debug("Skipping streamer {} without activity history", streamerId);
      return Optional.empty();
    } catch (NotFoundException ex) {
      log.warn("Skipping streamer {}: {}", streamerId, ex.getMessage());
      return Optional.empty();
    } catch (StoreFailureException ex) {
      if (ex.isCancelled()) {
        throw ex;
      }
      log.warn("Skipping streamer {}: {}", streamerId, ex.getMessage());
      return Optional.empty();
    }
  }
}
