package com.example.barshift.worker;

import com.example.barshift.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

    private final WorkerConstraintService workerService;

    public WorkerController(WorkerConstraintService workerService) {
        this.workerService = workerService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, WorkerConstraint>>> getAllWorkers() {
        Map<String, WorkerConstraint> workers = new LinkedHashMap<>(workerService.list());
        return ResponseEntity.ok(ApiResponse.success("Workers", workers, Map.of("count", workers.size())));
    }

    @GetMapping("/{name}")
    public ResponseEntity<ApiResponse<WorkerConstraint>> getWorker(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success("Worker", workerService.get(name)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<WorkerConstraint>> createWorker(@Valid @RequestBody WorkerRequest request) {
        WorkerConstraint constraint;
        if (request.constraintText() != null && !request.constraintText().isBlank()) {
            constraint = workerService.preview(request.constraintText()).constraint();
        } else if (request.constraints() != null) {
            constraint = request.constraints().toConstraint();
        } else {
            constraint = WorkerConstraint.defaults();
        }
        WorkerConstraint saved = workerService.add(request.name(), constraint);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Worker added", saved));
    }

    @PutMapping("/{name}/constraints")
    public ResponseEntity<ApiResponse<WorkerConstraint>> updateConstraints(@PathVariable String name,
                                                                           @Valid @RequestBody ConstraintRequest request) {
        WorkerConstraint saved = workerService.update(name, request.toConstraint());
        return ResponseEntity.ok(ApiResponse.success("Constraints updated", saved));
    }

    @PutMapping("/{name}/constraints/text")
    public ResponseEntity<ApiResponse<ConstraintTextParser.ParsedConstraints>> updateConstraintsFromText(
            @PathVariable String name, @RequestBody TextRequest request) {
        ConstraintTextParser.ParsedConstraints parsed = workerService.applyText(name, request.text());
        return ResponseEntity.ok(ApiResponse.success("Constraints updated", parsed,
                Map.of("ambiguous", !parsed.ambiguousLines().isEmpty())));
    }

    @PostMapping("/parse")
    public ResponseEntity<ApiResponse<ConstraintTextParser.ParsedConstraints>> parse(@RequestBody TextRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Constraints parsed", workerService.preview(request.text())));
    }

    @PutMapping("/{name}/name")
    public ResponseEntity<ApiResponse<Map<String, String>>> renameWorker(@PathVariable String name,
                                                                        @Valid @RequestBody RenameRequest request) {
        workerService.rename(name, request.name());
        return ResponseEntity.ok(ApiResponse.success("Worker renamed", Map.of("from", name, "to", request.name().trim())));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<ApiResponse<Void>> deleteWorker(@PathVariable String name) {
        workerService.remove(name);
        return ResponseEntity.ok(ApiResponse.success("Worker removed", null));
    }

    public record WorkerRequest(
            @NotBlank(message = "name is required") String name,
            String constraintText,
            @Valid ConstraintRequest constraints
    ) {}

    public record ConstraintRequest(
            List<String> allowedShifts,
            List<String> restrictedDays,
            List<String> restrictedShifts,
            @Min(value = 1, message = "maxShifts must be at least 1") Integer maxShifts
    ) {
        WorkerConstraint toConstraint() {
            return new WorkerConstraint(allowedShifts, restrictedDays, restrictedShifts,
                    maxShifts == null ? WorkerConstraint.DEFAULT_MAX_SHIFTS : maxShifts);
        }
    }

    public record TextRequest(String text) {}

    public record RenameRequest(@NotBlank(message = "name is required") String name) {}
}
