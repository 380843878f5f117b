package com.openforge.promptyoself.prompt;

import com.openforge.promptyoself.prompt.dto.RegisterPromptRequest;
import com.openforge.promptyoself.registration.RegistrationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * REST API over {@link PromptToolService}.
 *
 * Endpoints:
 *   POST   /api/prompts                    - register a once / cron / interval prompt
 *   GET    /api/prompts?agent_id=&all=&limit= - list schedules (active only unless all=true)
 *   DELETE /api/prompts/{id}               - cancel
 *   POST   /api/prompts/execute            - run one execution pass now
 *   GET    /api/prompts/agents             - agents known to the Letta server
 *   GET    /api/prompts/connection         - Letta connectivity check
 *   GET    /api/prompts/stats              - table statistics
 *   POST   /api/prompts/cleanup?days=      - delete old inactive schedules
 *
 * The body is always the ToolResponse envelope; only the status code varies.
 */
@RestController
@RequestMapping("/api/prompts")
@RequiredArgsConstructor
public class PromptController {

    private static final Set<String> CLIENT_ERRORS = Set.of(ToolResponse.INVALID_ARGUMENT);

    private final PromptToolService promptToolService;

    @PostMapping
    public ResponseEntity<ToolResponse> register(@Valid @RequestBody RegisterPromptRequest request) {
        return respond(promptToolService.register(request.toCommand()), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<ToolResponse> list(
            @RequestParam(name = "agent_id", required = false) String agentId,
            @RequestParam(name = "all", defaultValue = "false") boolean all,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return respond(promptToolService.list(agentId, all, limit), HttpStatus.OK);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ToolResponse> cancel(@PathVariable long id) {
        return respond(promptToolService.cancel(id), HttpStatus.OK);
    }

    @PostMapping("/execute")
    public ResponseEntity<ToolResponse> execute() {
        return respond(promptToolService.execute(), HttpStatus.OK);
    }

    @GetMapping("/agents")
    public ResponseEntity<ToolResponse> agents() {
        return respond(promptToolService.listAgents(), HttpStatus.OK);
    }

    @GetMapping("/connection")
    public ResponseEntity<ToolResponse> connection() {
        return respond(promptToolService.testConnection(), HttpStatus.OK);
    }

    @GetMapping("/stats")
    public ResponseEntity<ToolResponse> stats() {
        return respond(promptToolService.stats(), HttpStatus.OK);
    }

    @PostMapping("/cleanup")
    public ResponseEntity<ToolResponse> cleanup(@RequestParam(name = "days", required = false) Integer days) {
        return respond(promptToolService.cleanup(days), HttpStatus.OK);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ResponseEntity<ToolResponse> respond(ToolResponse response, HttpStatus onSuccess) {
        return ResponseEntity.status(response.isSuccess() ? onSuccess : statusFor(response.code())).body(response);
    }

    /**
     * Registration reasons and bad arguments → 400, unknown id → 404,
     * Letta unreachable → 502, anything else → 500.
     */
    static HttpStatus statusFor(String code) {
        if (code == null) return HttpStatus.INTERNAL_SERVER_ERROR;
        if (ToolResponse.NOT_FOUND.equals(code)) return HttpStatus.NOT_FOUND;
        if (ToolResponse.UPSTREAM_ERROR.equals(code)) return HttpStatus.BAD_GATEWAY;
        if (ToolResponse.INTERNAL_ERROR.equals(code)) return HttpStatus.INTERNAL_SERVER_ERROR;
        if (CLIENT_ERRORS.contains(code) || isRegistrationReason(code)) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static boolean isRegistrationReason(String code) {
        for (RegistrationException.Reason reason : RegistrationException.Reason.values()) {
            if (reason.name().equals(code)) return true;
        }
        return false;
    }
}
