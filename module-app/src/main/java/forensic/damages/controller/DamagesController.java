package forensic.damages.controller;

import forensic.damages.controller.dto.CpiTableResponse;
import forensic.damages.controller.dto.DamagesRequest;
import forensic.damages.core.domain.cpi.CpiCategory;
import forensic.damages.core.report.DamagesReport;
import forensic.damages.core.schedule.DetailedEarningsRow;
import forensic.damages.core.schedule.DetailedHouseholdRow;
import forensic.damages.core.schedule.DetailedLcpRow;
import forensic.damages.global.response.ApiResponse;
import forensic.damages.service.DamagesCalculationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Damages calculation API.
 *
 * <p>API list:
 *
 * <ul>
 *   <li>POST /api/v1/damages/calculate - full calculation as a report snapshot
 *   <li>POST /api/v1/damages/schedules/earnings - year-by-year earnings loss for one scenario
 *   <li>POST /api/v1/damages/schedules/life-care-plan - year-by-year life care plan
 *   <li>POST /api/v1/damages/schedules/household - year-by-year household services
 *   <li>GET /api/v1/damages/cpi-categories - configured CPI table
 *   <li>GET /api/v1/damages/cpi-categories/{id} - one CPI category
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/damages")
@RequiredArgsConstructor
@Tag(name = "Damages", description = "Economic damages calculation API")
public class DamagesController {

  private final DamagesCalculationService damagesService;

  @PostMapping("/calculate")
  @Operation(
      summary = "Calculate damages",
      description =
          "Runs the full pipeline: dates, algebraic factors, earnings projection, household"
              + " services, life care plan, retirement scenarios and grand total.")
  public ResponseEntity<ApiResponse<DamagesReport>> calculate(
      @Valid @RequestBody DamagesRequest request) {
    return ResponseEntity.ok(ApiResponse.success(damagesService.calculate(request)));
  }

  @PostMapping("/schedules/earnings")
  @Operation(
      summary = "Earnings schedule",
      description = "Past and future earnings loss rows under one scenario's retirement age.")
  public ResponseEntity<ApiResponse<List<DetailedEarningsRow>>> earningsSchedule(
      @Valid @RequestBody DamagesRequest request,
      @RequestParam(required = false) String scenario,
      @RequestParam(required = false) Integer baseCalendarYear) {
    return ResponseEntity.ok(
        ApiResponse.success(
            damagesService.earningsSchedule(request, scenario, baseCalendarYear)));
  }

  @PostMapping("/schedules/life-care-plan")
  @Operation(summary = "Life care plan schedule", description = "Plan years with any cost.")
  public ResponseEntity<ApiResponse<List<DetailedLcpRow>>> lifeCarePlanSchedule(
      @Valid @RequestBody DamagesRequest request,
      @RequestParam(required = false) Integer baseCalendarYear) {
    return ResponseEntity.ok(
        ApiResponse.success(damagesService.lifeCarePlanSchedule(request, baseCalendarYear)));
  }

  @PostMapping("/schedules/household")
  @Operation(
      summary = "Household services schedule",
      description = "One row per year to final separation; empty when the claim is inactive.")
  public ResponseEntity<ApiResponse<List<DetailedHouseholdRow>>> householdSchedule(
      @Valid @RequestBody DamagesRequest request,
      @RequestParam(required = false) Integer baseCalendarYear) {
    return ResponseEntity.ok(
        ApiResponse.success(damagesService.householdSchedule(request, baseCalendarYear)));
  }

  @GetMapping("/cpi-categories")
  @Operation(summary = "CPI categories", description = "Medical CPI rates by category.")
  public ResponseEntity<ApiResponse<CpiTableResponse>> cpiCategories() {
    return ResponseEntity.ok(
        ApiResponse.success(CpiTableResponse.from(damagesService.cpiTable())));
  }

  @GetMapping("/cpi-categories/{id}")
  @Operation(summary = "CPI category", description = "One category; 404 when unknown.")
  public ResponseEntity<ApiResponse<CpiCategory>> cpiCategory(@PathVariable String id) {
    return ResponseEntity.ok(ApiResponse.success(damagesService.cpiCategory(id)));
  }
}
