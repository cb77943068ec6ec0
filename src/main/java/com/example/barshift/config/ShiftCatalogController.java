package com.example.barshift.config;

import com.example.barshift.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/config/shifts")
public class ShiftCatalogController {

    private final ShiftCatalogService catalogService;

    public ShiftCatalogController(ShiftCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftDefinition>>> getAllShifts() {
        List<ShiftDefinition> shifts = catalogService.list();
        return ResponseEntity.ok(ApiResponse.success("Shifts", shifts, Map.of("count", shifts.size())));
    }

    @GetMapping("/active")
    public ResponseEntity<ApiResponse<List<ShiftDefinition>>> getActiveShifts() {
        return ResponseEntity.ok(ApiResponse.success("Active shifts", catalogService.activeShifts()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftDefinition>> createShift(@Valid @RequestBody ShiftRequest request) {
        boolean active = request.active() == null || request.active();
        ShiftDefinition created = catalogService.add(request.label(), active);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Shift added", created));
    }

    @PostMapping("/{label}/toggle")
    public ResponseEntity<ApiResponse<ShiftDefinition>> toggleShift(@PathVariable String label) {
        return ResponseEntity.ok(ApiResponse.success("Shift toggled", catalogService.toggle(label)));
    }

    @DeleteMapping("/{label}")
    public ResponseEntity<ApiResponse<Void>> deleteShift(@PathVariable String label) {
        catalogService.remove(label);
        return ResponseEntity.ok(ApiResponse.success("Shift removed", null));
    }

    public record ShiftRequest(
            @NotBlank(message = "label is required") String label,
            Boolean active
    ) {}
}
