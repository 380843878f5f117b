package com.openforge.promptyoself.prompt.dto;

import com.openforge.promptyoself.registration.RegisterCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/prompts.
 *
 * Exactly one of time / cron / every must be given; that rule, time parsing
 * and the max_repetitions check are left to the registration service so the
 * caller gets the same error text over every transport.
 *
 * @param maxRepetitions kept as text so "abc" is reported as an invalid
 *                       repetition count rather than a malformed body
 */
public record RegisterPromptRequest(

        @NotBlank(message = "agent_id must not be blank")
        @Size(max = 100, message = "agent_id must not exceed 100 characters")
        String agentId,

        @NotBlank(message = "prompt must not be blank")
        String prompt,

        String time,

        @Size(max = 200, message = "cron must not exceed 200 characters")
        String cron,

        @Size(max = 200, message = "every must not exceed 200 characters")
        String every,

        String maxRepetitions,

        String startAt,

        Boolean skipValidation
) {

    public RegisterCommand toCommand() {
        return RegisterCommand.builder()
                .agentId(agentId)
                .prompt(prompt)
                .time(time)
                .cron(cron)
                .every(every)
                .maxRepetitions(maxRepetitions)
                .startAt(startAt)
                .skipValidation(Boolean.TRUE.equals(skipValidation))
                .build();
    }
}
