package com.ospicorp.livewhen.calendar;

import static com.ospicorp.livewhen.web.PathIds.ID_REGEX;

import com.ospicorp.livewhen.web.WeekParameters;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.ZonedDateTime;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}")
@Validated
@Tag(name = "Calendar")
public class CalendarController {
  private final CalendarService calendarService;
  private final WeekParameters weekParameters;

  public CalendarController(CalendarService calendarService, WeekParameters weekParameters) {
    this.calendarService = calendarService;
    this.weekParameters = weekParameters;
  }

  @GetMapping("/calendar")
  @Operation(summary = "Weekly calendar",
      description = "The user's programme as a 24x7 grid with links to the adjacent weeks.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Calendar",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CalendarView.class))),
      @ApiResponse(responseCode = "404", description = "Unknown user",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CalendarView calendar(@PathVariable @Pattern(regexp = ID_REGEX) String userId,
      @RequestParam(required = false) @Parameter(description = "Any date in the base week",
          example = "2024-01-15") String week,
      @RequestParam(required = false) @Parameter(description = "prev, previous or next; "
          + "anything else stays on the base week") String direction) {
    ZonedDateTime target = WeekNavigator.navigateWeek(weekParameters.resolve(week), direction);
    return calendarService.getCalendarView(userId, target);
  }
}
