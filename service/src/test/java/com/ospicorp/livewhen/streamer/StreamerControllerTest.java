package com.ospicorp.livewhen.streamer;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.livewhen.activity.ActivityRecord;
import com.ospicorp.livewhen.common.InsufficientDataException;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.common.StoreFailureException;
import com.ospicorp.livewhen.config.SecurityConfig;
import com.ospicorp.livewhen.heatmap.Heatmap;
import com.ospicorp.livewhen.heatmap.HeatmapService;
import com.ospicorp.livewhen.programme.PredictedTime;
import com.ospicorp.livewhen.programme.TvProgrammeService;
import com.ospicorp.livewhen.web.FixedClockConfig;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StreamerController.class)
@Import({SecurityConfig.class, FixedClockConfig.class})
class StreamerControllerTest {

  private static final Instant CREATED = Instant.parse("2023-01-01T00:00:00Z");

  @Autowired
  private MockMvc mvc;

  @MockBean
  private FollowerRanker followerRanker;

  @MockBean
  private HeatmapService heatmapService;

  @MockBean
  private TvProgrammeService tvProgrammeService;

  @Test
  void heatmapUsesSnakeCaseFields() throws Exception {
    double[] hours = new double[24];
    hours[20] = 0.8;
    given(heatmapService.generateHeatmap("owl"))
        .willReturn(new Heatmap("owl", hours, new double[7], 3, FixedClockConfig.NOW));

    mvc.perform(get("/v1/streamers/owl/heatmap"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.streamer_id").value("owl"))
        .andExpect(jsonPath("$.hours", hasSize(24)))
        .andExpect(jsonPath("$.hours[20]").value(0.8))
        .andExpect(jsonPath("$.days_of_week", hasSize(7)))
        .andExpect(jsonPath("$.data_points").value(3));
  }

  @Test
  void missingHistoryIsProblemDetail() throws Exception {
    given(heatmapService.generateHeatmap("quiet"))
        .willThrow(new InsufficientDataException("quiet"));

    mvc.perform(get("/v1/streamers/quiet/heatmap"))
        .andExpect(status().isNotFound())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.type", endsWith("/insufficient-data")))
        .andExpect(jsonPath("$.path").value("/v1/streamers/quiet/heatmap"));
  }

  @Test
  void invalidDayCarriesErrorCode() throws Exception {
    given(tvProgrammeService.getPredictedLiveTime("owl", 9)).willThrow(new InvalidInputException(
        "day of week must be between 0 and 6", InvalidInputException.DAY_OF_WEEK_OUT_OF_RANGE));

    mvc.perform(get("/v1/streamers/owl/predictions/9"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(InvalidInputException.DAY_OF_WEEK_OUT_OF_RANGE))
        .andExpect(jsonPath("$.moreInfo", endsWith("/1002")))
        .andExpect(jsonPath("$.path").value("/v1/streamers/owl/predictions/9"));
  }

  @Test
  void predictionIsReturned() throws Exception {
    given(tvProgrammeService.getPredictedLiveTime("owl", 1))
        .willReturn(new PredictedTime(1, 20, 0.64));

    mvc.perform(get("/v1/streamers/owl/predictions/1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.day_of_week").value(1))
        .andExpect(jsonPath("$.hour").value(20));
  }

  @Test
  void rankedStreamersIncludeFollowerCounts() throws Exception {
    Streamer owl = new Streamer("owl", "Night Owl", Map.of(Platform.TWITCH, "owl_tv"), CREATED);
    given(followerRanker.getStreamersRankedByFollowers(5))
        .willReturn(List.of(new StreamerWithFollowers(owl, 42)));

    mvc.perform(get("/v1/streamers/ranked").param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].streamer.id").value("owl"))
        .andExpect(jsonPath("$[0].streamer.handles.twitch").value("owl_tv"))
        .andExpect(jsonPath("$[0].follower_count").value(42));
  }

  @Test
  void recordsActivityWithPlatform() throws Exception {
    Instant seen = Instant.parse("2024-01-15T11:00:00Z");
    given(heatmapService.recordActivity(eq("owl"), eq(seen), eq(Platform.TWITCH)))
        .willReturn(new ActivityRecord("r1", "owl", seen, seen, Platform.TWITCH,
            FixedClockConfig.NOW));

    mvc.perform(post("/v1/streamers/owl/activity")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"timestamp\":\"2024-01-15T11:00:00Z\",\"platform\":\"twitch\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value("r1"))
        .andExpect(jsonPath("$.streamer_id").value("owl"));

    verify(heatmapService).recordActivity("owl", seen, Platform.TWITCH);
  }

  @Test
  void unknownPlatformIsRejected() throws Exception {
    mvc.perform(post("/v1/streamers/owl/activity")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"timestamp\":\"2024-01-15T11:00:00Z\",\"platform\":\"myspace\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(InvalidInputException.INVALID_PLATFORM));

    verifyNoInteractions(heatmapService);
  }

  @Test
  void storeFailureIsServiceUnavailable() throws Exception {
    given(heatmapService.getActivityStats(any())).willThrow(StoreFailureException.wrap(
        "read activity records", new QueryTimeoutException("statement timeout")));

    mvc.perform(get("/v1/streamers/owl/stats"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.type", endsWith("/store-unavailable")));
  }

  @Test
  void responsesCarrySecurityHeaders() throws Exception {
    given(tvProgrammeService.getPredictedLiveTime("owl", 1))
        .willReturn(new PredictedTime(1, 20, 0.64));

    mvc.perform(get("/v1/streamers/owl/predictions/1"))
        .andExpect(header().string("X-Frame-Options", "DENY"))
        .andExpect(header().string("X-Content-Type-Options", "nosniff"))
        .andExpect(header().string("Cross-Origin-Opener-Policy", "same-origin"));
  }

  @Test
  void overlongStreamerIdIsRejectedBeforeStorage() throws Exception {
    mvc.perform(post("/v1/streamers/" + "x".repeat(65) + "/activity")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"timestamp\":\"2024-01-15T10:00:00Z\",\"platform\":\"twitch\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.type", endsWith("invalid-parameter")));

    verifyNoInteractions(heatmapService);
  }

  @Test
  void streamerIdWithSpacesIsRejected() throws Exception {
    mvc.perform(get("/v1/streamers/night owl/stats"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(heatmapService);
  }
}
