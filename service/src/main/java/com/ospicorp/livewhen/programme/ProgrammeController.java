package com.ospicorp.livewhen.programme;

import static com.ospicorp.livewhen.web.PathIds.ID_REGEX;

import com.ospicorp.livewhen.calendar.CalendarService;
import com.ospicorp.livewhen.calendar.CalendarView;
import com.ospicorp.livewhen.web.WeekParameters;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Programmes")
public class ProgrammeController {
  private final TvProgrammeService tvProgrammeService;
  private final ProgrammeService programmeService;
  private final CalendarService calendarService;
  private final WeekParameters weekParameters;

  public ProgrammeController(TvProgrammeService tvProgrammeService,
      ProgrammeService programmeService, CalendarService calendarService,
      WeekParameters weekParameters) {
    this.tvProgrammeService = tvProgrammeService;
    this.programmeService = programmeService;
    this.calendarService = calendarService;
    this.weekParameters = weekParameters;
  }

  @GetMapping("/users/{userId}/programme")
  @Operation(summary = "Weekly programme",
      description = "Predicted live slots of every streamer the user follows.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Programme",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TvProgramme.class))),
      @ApiResponse(responseCode = "404", description = "Unknown user",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public TvProgramme programme(@PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @RequestParam(required = false) @Parameter(description = "Any date in the week",
          example = "2024-01-15") String week) {
    return tvProgrammeService.generateProgramme(userId, weekParameters.resolve(week));
  }

  @GetMapping("/users/{userId}/programme-view")
  @Operation(summary = "Programme view",
      description = "The user's custom programme when it has streamers, otherwise the global "
          + "top ten.")
  public CalendarView programmeView(@PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @RequestParam(required = false) String week) {
    return calendarService.getProgrammeCalendar(userId, weekParameters.resolve(week));
  }

  @GetMapping("/programmes/global")
  @Operation(summary = "Global programme",
      description = "Predicted week of the most followed streamers.")
  public CalendarView global(@RequestParam(required = false) String week,
      @RequestParam(defaultValue = "10") int limit) {
    return calendarService.fromProgrammeView(
        programmeService.generateGlobalProgramme(weekParameters.resolve(week), limit));
  }

  @GetMapping("/programmes/default")
  @Operation(summary = "Default week view",
      description = "Global programme of the current week with follower counts.")
  public DefaultWeekView defaultView() {
    return programmeService.getDefaultWeekView();
  }

  @PostMapping("/programmes/guest/calendar")
  @Operation(summary = "Guest calendar",
      description = "Calendar of an ad-hoc list of streamers. Nothing is stored.")
  public CalendarView guestCalendar(@RequestBody CustomProgrammeRequest request,
      @RequestParam(required = false) String week) {
    CustomProgramme guest = programmeService.createGuestProgramme(request.streamerIdsOrEmpty());
    return calendarService.fromProgrammeView(
        programmeService.generateCalendarFromProgramme(guest, weekParameters.resolve(week)));
  }

  @GetMapping("/users/{userId}/custom-programme")
  @Tag(name = "Custom programmes")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Custom programme"),
      @ApiResponse(responseCode = "404", description = "No custom programme",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CustomProgramme getCustomProgramme(
      @PathVariable @Pattern(regexp = ID_REGEX) String userId) {
    return programmeService.getCustomProgramme(userId);
  }

  @PostMapping("/users/{userId}/custom-programme")
  @Tag(name = "Custom programmes")
  public ResponseEntity<CustomProgramme> createCustomProgramme(
      @PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @RequestBody CustomProgrammeRequest request) {
    CustomProgramme created = programmeService.createCustomProgramme(userId,
        request.streamerIdsOrEmpty());
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/users/{userId}/custom-programme")
  @Tag(name = "Custom programmes")
  public CustomProgramme updateCustomProgramme(
      @PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @RequestBody CustomProgrammeRequest request) {
    return programmeService.updateCustomProgramme(userId, request.streamerIdsOrEmpty());
  }

  @DeleteMapping("/users/{userId}/custom-programme")
  @Tag(name = "Custom programmes")
  public ResponseEntity<Void> deleteCustomProgramme(
      @PathVariable @Pattern(regexp = ID_REGEX) String userId) {
    programmeService.deleteCustomProgramme(userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/users/{userId}/custom-programme/streamers/{streamerId}")
  @Tag(name = "Custom programmes")
  public CustomProgramme addStreamer(@PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @PathVariable @Pattern(regexp = ID_REGEX) String streamerId) {
    return programmeService.addStreamerToProgramme(userId, streamerId);
  }

  @DeleteMapping("/users/{userId}/custom-programme/streamers/{streamerId}")
  @Tag(name = "Custom programmes")
  public CustomProgramme removeStreamer(@PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @PathVariable @Pattern(regexp = ID_REGEX) String streamerId) {
    return programmeService.removeStreamerFromProgramme(userId, streamerId);
  }
}
