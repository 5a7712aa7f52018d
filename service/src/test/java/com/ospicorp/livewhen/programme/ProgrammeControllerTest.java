package com.ospicorp.livewhen.programme;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.livewhen.calendar.CalendarController;
import com.ospicorp.livewhen.calendar.CalendarService;
import com.ospicorp.livewhen.calendar.CalendarView;
import com.ospicorp.livewhen.common.ConflictException;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.common.NotFoundException;
import com.ospicorp.livewhen.config.SecurityConfig;
import com.ospicorp.livewhen.web.FixedClockConfig;
import com.ospicorp.livewhen.web.WeekParameters;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ProgrammeController.class, CalendarController.class})
@Import({SecurityConfig.class, FixedClockConfig.class, WeekParameters.class})
class ProgrammeControllerTest {

  private static final ZonedDateTime JAN_15 =
      ZonedDateTime.of(2024, 1, 15, 0, 0, 0, 0, ZoneOffset.UTC);

  @Autowired
  private MockMvc mvc;

  @MockBean
  private TvProgrammeService tvProgrammeService;

  @MockBean
  private ProgrammeService programmeService;

  @MockBean
  private CalendarService calendarService;

  private static CalendarView emptyView(ZonedDateTime week) {
    return new CalendarView(week, week.minusWeeks(1), week.plusWeeks(1), List.of(), Map.of(),
        List.of(), false, false);
  }

  @Test
  void weekParameterIsMidnightInClockZone() throws Exception {
    ZonedDateTime weekStart = JAN_15.minusDays(1);
    given(tvProgrammeService.generateProgramme("viewer", JAN_15)).willReturn(
        new TvProgramme("viewer", weekStart, List.of(new ProgrammeEntry("owl", 1, 20, 0.64)),
            FixedClockConfig.NOW));

    mvc.perform(get("/v1/users/viewer/programme").param("week", "2024-01-15"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("viewer"))
        .andExpect(jsonPath("$.entries", hasSize(1)))
        .andExpect(jsonPath("$.entries[0].day_of_week").value(1));

    verify(tvProgrammeService).generateProgramme("viewer", JAN_15);
  }

  @Test
  void absentWeekMeansNow() throws Exception {
    ZonedDateTime now = FixedClockConfig.NOW.atZone(ZoneOffset.UTC);
    given(tvProgrammeService.generateProgramme("viewer", now))
        .willReturn(new TvProgramme("viewer", now, List.of(), FixedClockConfig.NOW));

    mvc.perform(get("/v1/users/viewer/programme")).andExpect(status().isOk());

    verify(tvProgrammeService).generateProgramme("viewer", now);
  }

  @Test
  void malformedWeekIsRejected() throws Exception {
    mvc.perform(get("/v1/users/viewer/programme").param("week", "15/01/2024"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(InvalidInputException.INVALID_WEEK));

    verifyNoInteractions(tvProgrammeService);
  }

  @Test
  void unknownUserIsNotFound() throws Exception {
    given(tvProgrammeService.generateProgramme(eq("ghost"), any()))
        .willThrow(NotFoundException.user("ghost"));

    mvc.perform(get("/v1/users/ghost/programme"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("User not found: ghost"));
  }

  @Test
  void calendarNavigatesToNextWeek() throws Exception {
    ZonedDateTime next = ZonedDateTime.of(2024, 1, 21, 0, 0, 0, 0, ZoneOffset.UTC);
    given(calendarService.getCalendarView("viewer", next)).willReturn(emptyView(next));

    mvc.perform(get("/v1/users/viewer/calendar")
            .param("week", "2024-01-15")
            .param("direction", "next"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.is_custom").value(false))
        .andExpect(jsonPath("$.prev_week").exists());

    verify(calendarService).getCalendarView("viewer", next);
  }

  @Test
  void createsCustomProgramme() throws Exception {
    Instant now = FixedClockConfig.NOW;
    given(programmeService.createCustomProgramme("viewer", List.of("owl", "lark")))
        .willReturn(new CustomProgramme("p1", "viewer", List.of("owl", "lark"), now, now));

    mvc.perform(post("/v1/users/viewer/custom-programme")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"streamer_ids\":[\"owl\",\"lark\"]}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value("p1"))
        .andExpect(jsonPath("$.streamer_ids", hasSize(2)))
        .andExpect(jsonPath("$.guest").doesNotExist());
  }

  @Test
  void deletesCustomProgramme() throws Exception {
    mvc.perform(delete("/v1/users/viewer/custom-programme"))
        .andExpect(status().isNoContent());

    verify(programmeService).deleteCustomProgramme("viewer");
  }

  @Test
  void guestCalendarBuildsFromPostedStreamers() throws Exception {
    Instant now = FixedClockConfig.NOW;
    CustomProgramme guest = new CustomProgramme("g1", "", List.of("owl"), now, now);
    ProgrammeCalendarView view =
        new ProgrammeCalendarView(JAN_15.minusDays(1), List.of(), List.of(), true, true);
    given(programmeService.createGuestProgramme(List.of("owl"))).willReturn(guest);
    given(programmeService.generateCalendarFromProgramme(guest, JAN_15)).willReturn(view);
    given(calendarService.fromProgrammeView(view)).willReturn(new CalendarView(
        JAN_15.minusDays(1), null, null, List.of(), Map.of(), List.of(), true, true));

    mvc.perform(post("/v1/programmes/guest/calendar")
            .param("week", "2024-01-15")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"streamerIds\":[\"owl\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.is_guest_session").value(true));
  }

  @Test
  void existingCustomProgrammeIsConflict() throws Exception {
    given(programmeService.createCustomProgramme("viewer", List.of("owl")))
        .willThrow(ConflictException.customProgrammeExists("viewer", null));

    mvc.perform(post("/v1/users/viewer/custom-programme")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"streamer_ids\":[\"owl\"]}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.type", endsWith("conflict")));
  }

  @Test
  void overlongUserIdIsRejected() throws Exception {
    mvc.perform(get("/v1/users/" + "u".repeat(65) + "/calendar"))
        .andExpect(status().isBadRequest());
    mvc.perform(post("/v1/users/viewer/custom-programme/streamers/" + "s".repeat(65)))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(calendarService, programmeService);
  }
}
