package com.openforge.promptyoself.delivery;

/**
 * Answers whether an agent id is known to the messaging platform.
 * Consulted only before registration, and only when the caller has not
 * asked to skip validation.
 */
public interface AgentDirectory {

    AgentValidation validate(String agentId);

    /**
     * @param exists  true when the agent was found
     * @param name    display name, when found
     * @param message reason the lookup failed or found nothing
     */
    record AgentValidation(boolean exists, String name, String message) {

        public static AgentValidation found(String name) {
            return new AgentValidation(true, name, null);
        }

        public static AgentValidation missing(String message) {
            return new AgentValidation(false, null, message);
        }
    }
}
