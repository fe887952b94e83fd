package io.shiftmate.backend.ratetier;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rate card authoring. {@code weeknight} is accepted as a day type but tiered billing never looks
 * it up: weekday shifts are priced against the weekday card for all of their hours, and the
 * weeknight split applies to employee rates only.
 */
@RestController
@RequestMapping("/api/rate-tiers")
public class RateTierController {

  private final RateTierService rateTierService;

  public RateTierController(RateTierService rateTierService) {
    this.rateTierService = rateTierService;
  }

  @GetMapping
  public ResponseEntity<ListResponse<RateTierResponse>> listTiers(@RequestParam Long companyId) {
    var content =
        rateTierService.listTiers(companyId).stream().map(RateTierResponse::from).toList();
    return ResponseEntity.ok(new ListResponse<>(content));
  }

  @GetMapping("/coverage-gaps")
  public ResponseEntity<ListResponse<RateTierService.CoverageGap>> coverageGaps(
      @RequestParam Long companyId) {
    return ResponseEntity.ok(new ListResponse<>(rateTierService.coverageGaps(companyId)));
  }

  @PostMapping
  public ResponseEntity<RateTierResponse> createTier(
      @Valid @RequestBody CreateRateTierRequest request) {
    var tier =
        rateTierService.createTier(
            request.companyId(),
            request.shiftType(),
            request.dayType(),
            request.tierOrder(),
            request.hoursInTier(),
            request.ratePerHour(),
            request.currency(),
            request.validFrom(),
            request.validTo());
    return ResponseEntity.created(URI.create("/api/rate-tiers/" + tier.getId()))
        .body(RateTierResponse.from(tier));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTier(@PathVariable Long id) {
    rateTierService.deleteTier(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record ListResponse<T>(List<T> content) {}

  public record CreateRateTierRequest(
      @NotNull(message = "companyId is required") Long companyId,
      @NotBlank(message = "shiftType is required") String shiftType,
      @NotBlank(message = "dayType is required") String dayType,
      @Min(value = 1, message = "tierOrder must be 1 or greater") int tierOrder,
      @Positive(message = "hoursInTier must be positive") BigDecimal hoursInTier,
      @PositiveOrZero(message = "ratePerHour must not be negative") long ratePerHour,
      @Size(min = 3, max = 3, message = "currency must be exactly 3 characters") String currency,
      LocalDate validFrom,
      LocalDate validTo) {}

  public record RateTierResponse(
      Long id,
      Long companyId,
      String shiftType,
      String dayType,
      int tierOrder,
      BigDecimal hoursInTier,
      long ratePerHour,
      String currency,
      LocalDate validFrom,
      LocalDate validTo) {

    public static RateTierResponse from(RateTier tier) {
      return new RateTierResponse(
          tier.getId(),
          tier.getCompanyId(),
          tier.getShiftType(),
          tier.getDayType(),
          tier.getTierOrder(),
          tier.getHoursInTier(),
          tier.getRatePerHour(),
          tier.getCurrency(),
          tier.getValidFrom(),
          tier.getValidTo());
    }
  }
}
