package com.codeflag.scheduler.api;

import com.codeflag.scheduler.api.dto.SubmitRequest;
import com.codeflag.scheduler.api.dto.SubmitResponse;
import com.codeflag.scheduler.service.SubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * POST /submit: run code and answer with the flag of its output.
 *
 * The request thread blocks until the result arrives or the execution
 * deadline passes.
 *
 * Example:
 *   curl -X POST http://localhost:8001/submit \
 *     -H "Content-Type: application/json" \
 *     -d '{"code":"print(\"hi\")","language":"python"}'
 */
@RestController
public class SubmitController {

    private final SubmissionService submissionService;

    public SubmitController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping("/submit")
    public SubmitResponse submit(@RequestBody SubmitRequest req) {
        if (isBlank(req.code()) || isBlank(req.language())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Missing 'code' or 'language' in request body.");
        }
        String settings = null;
        if (req.hasSettings()) {
            if (!req.settings().isTextual()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Settings must be a string.");
            }
            settings = req.settings().asText();
        }
        return new SubmitResponse(submissionService.submit(req.code(), req.language(), settings));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
