package io.shiftmate.backend.calendar;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/public-holidays")
public class PublicHolidayController {

  private final PublicHolidayService publicHolidayService;

  public PublicHolidayController(PublicHolidayService publicHolidayService) {
    this.publicHolidayService = publicHolidayService;
  }

  @GetMapping
  public ResponseEntity<List<PublicHolidayResponse>> listHolidays() {
    var content =
        publicHolidayService.listHolidays().stream().map(PublicHolidayResponse::from).toList();
    return ResponseEntity.ok(content);
  }

  @PostMapping
  public ResponseEntity<PublicHolidayResponse> createHoliday(
      @Valid @RequestBody CreatePublicHolidayRequest request) {
    var holiday = publicHolidayService.createHoliday(request.date(), request.description());
    return ResponseEntity.created(URI.create("/api/public-holidays/" + holiday.getId()))
        .body(PublicHolidayResponse.from(holiday));
  }

  // --- DTOs ---

  public record CreatePublicHolidayRequest(
      @NotNull(message = "date is required") LocalDate date,
      @NotBlank(message = "description is required") String description) {}

  public record PublicHolidayResponse(Long id, LocalDate date, String description) {

    public static PublicHolidayResponse from(PublicHoliday holiday) {
      return new PublicHolidayResponse(
          holiday.getId(), holiday.getDate(), holiday.getDescription());
    }
  }
}
