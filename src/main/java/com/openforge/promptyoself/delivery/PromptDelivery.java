package com.openforge.promptyoself.delivery;

/**
 * Sends a prompt to an agent.  Any retry or backoff happens inside the
 * implementation; the execution pass calls this once per due reminder.
 */
public interface PromptDelivery {

    /**
     * @return true if the agent accepted the message, false after the
     *         implementation has given up.  Never throws for a routine
     *         delivery failure.
     */
    boolean deliver(String agentId, String text);
}
