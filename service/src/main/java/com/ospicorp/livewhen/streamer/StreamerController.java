package com.ospicorp.livewhen.streamer;

import static com.ospicorp.livewhen.web.PathIds.ID_REGEX;

import com.ospicorp.livewhen.activity.ActivityRecord;
import com.ospicorp.livewhen.activity.ActivityStats;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.heatmap.Heatmap;
import com.ospicorp.livewhen.heatmap.HeatmapService;
import com.ospicorp.livewhen.programme.PredictedTime;
import com.ospicorp.livewhen.programme.TvProgrammeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/streamers")
@Validated
@Tag(name = "Streamers")
public class StreamerController {
  private final FollowerRanker followerRanker;
  private final HeatmapService heatmapService;
  private final TvProgrammeService tvProgrammeService;

  public StreamerController(FollowerRanker followerRanker, HeatmapService heatmapService,
      TvProgrammeService tvProgrammeService) {
    this.followerRanker = followerRanker;
    this.heatmapService = heatmapService;
    this.tvProgrammeService = tvProgrammeService;
  }

  @GetMapping("/ranked")
  @Operation(summary = "Rank streamers",
      description = "Streamers ordered by follower count, most followed first.")
  public List<RankedStreamerDto> ranked(
      @RequestParam(defaultValue = "10") @Parameter(description = "Maximum number of streamers; "
          + "zero or negative means 10", example = "10") int limit) {
    return followerRanker.getStreamersRankedByFollowers(limit).stream()
        .map(RankedStreamerDto::from)
        .toList();
  }

  @GetMapping("/{id}/heatmap")
  @Operation(summary = "Generate heatmap",
      description = "Recomputes the activity heatmap of a streamer from the last 365 days and "
          + "stores it.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Heatmap",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Heatmap.class))),
      @ApiResponse(responseCode = "404", description = "No activity in the lookback window",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Heatmap heatmap(@PathVariable @Pattern(regexp = ID_REGEX)
      @Parameter(description = "Streamer identifier", example = "nightowl") String id) {
    return heatmapService.generateHeatmap(id);
  }

  @GetMapping("/{id}/stats")
  @Operation(summary = "Activity statistics",
      description = "Session count, average duration and peak hour/day over the last 365 days.")
  public ActivityStats stats(@PathVariable @Pattern(regexp = ID_REGEX) String id) {
    return heatmapService.getActivityStats(id);
  }

  @PostMapping("/{id}/activity")
  @Operation(summary = "Record activity", description = "Appends a live observation.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Recorded"),
      @ApiResponse(responseCode = "400", description = "Bad request")
  })
  public ResponseEntity<ActivityRecord> recordActivity(
      @PathVariable @Pattern(regexp = ID_REGEX) String id,
      @RequestBody ActivityRequest request) {
    ActivityRecord recorded = heatmapService.recordActivity(id, request.timestamp(),
        parsePlatform(request.platform()));
    return ResponseEntity.status(HttpStatus.CREATED).body(recorded);
  }

  @GetMapping("/{id}/predictions/{dayOfWeek}")
  @Operation(summary = "Predict live time",
      description = "Most likely hour for the given day of week (0 = Sunday).")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Prediction",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = PredictedTime.class))),
      @ApiResponse(responseCode = "400", description = "Day of week outside 0..6"),
      @ApiResponse(responseCode = "404", description = "No activity in the lookback window",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public PredictedTime predict(@PathVariable @Pattern(regexp = ID_REGEX) String id,
      @PathVariable int dayOfWeek) {
    return tvProgrammeService.getPredictedLiveTime(id, dayOfWeek);
  }

  private Platform parsePlatform(String platform) {
    try {
      return Platform.fromCode(platform);
    } catch (IllegalArgumentException ex) {
      throw new InvalidInputException("Unsupported platform: " + platform
          + ". Expected one of youtube, twitch, kick", InvalidInputException.INVALID_PLATFORM);
    }
  }
}
