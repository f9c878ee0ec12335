package com.deepansh.salesagent.tool;

import java.util.Map;
import java.util.Set;

/**
 * Contract every catalog tool must implement.
 *
 * Unlike a chat-loop tool, a sales tool returns structured data (maps, lists,
 * numbers) and signals failure by throwing. The executor catches everything a
 * tool throws and turns it into a failed step, so one bad step never stops a plan.
 */
public interface SalesTool {

    /** Unique snake_case action name the planner uses. */
    String getName();

    /** One line, shown to the planner next to the parameter list. */
    String getDescription();

    /** Parameters a plan step must carry for the validator to accept it. */
    Set<String> getRequiredParams();

    /**
     * Every parameter the tool accepts. Anything else is stripped after
     * resolution, right before dispatch.
     */
    Set<String> getAllowedParams();

    /**
     * Run the tool against already-resolved parameters.
     *
     * @throws Exception on any failure; the message becomes the step's error text
     */
    Object execute(Map<String, Object> params) throws Exception;
}
