package com.lexcoach.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Well-known coaching tools referenced by the keyword fallback planner
    public static final String TOOL_PRACTICE_QUESTION = "get_practice_question";
    public static final String TOOL_LEARNING_PROGRESS = "get_learning_progress";
    public static final String TOOL_DOCUMENT_SEARCH = "english_search_document";

    public static final String ARG_USER_ID = "user_id";

    // LLM Request Purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_PLAN_RETRY = "plan-retry";
    public static final String PURPOSE_RESPOND = "respond";

    // Limits
    public static final int MAX_RESULT_CHARS = 1000;
    public static final int MAX_MEMORY_CHARS = 600;

    // Default messages
    public static final String NO_REASONING = "No reasoning provided";
    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";
    public static final String PLANNING_FAILED_MESSAGE = "I'm sorry, I couldn't work out how to help with that just now. Please try again in a moment.";
    public static final String RUN_FAILED_MESSAGE = "I'm sorry, something went wrong while handling your request and it could not be completed.";
    public static final String REJECTED_FALLBACK_MESSAGE = "Understood, I won't go ahead with that plan.";

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planner of a study coach that helps students prepare for the CLAT exam.
            You have access to the following tools:

            Available Tools:
            %s

            Your task: analyze the user's latest message and decide whether any tools are needed. Be specific about WHY.
            Only use tool names from the list above. Take earlier conversation turns and reviewer feedback into account.

            Reply only with JSON in this exact format:
            {
              "needs_tools": true,
              "reasoning": "why these tools are used, or why no tool is needed",
              "confidence": 0.0,
              "tools_to_use": [
                {
                  "tool_name": "exact_tool_name",
                  "parameters": {"param1": "value1"},
                  "reason": "why this tool with these parameters"
                }
              ]
            }

            "confidence" is a number between 0 and 1 describing how sure you are that the plan is right.
            If no tools are needed, use an empty array for tools_to_use and set needs_tools to false.
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            Conversation so far:
            %s

            Latest user message:
            %s
            """;

    public static final String RESPONDER_TOOLS_PROMPT = """
            You are a helpful assistant specialized in CLAT exam preparation.

            Please follow these guidelines when responding:
            1. Answer the user's question directly and helpfully.
            2. Use the tool results and planning information provided to keep answers accurate and relevant.
            3. If a tool result includes a practice question, present it clearly with its options.
            4. If a tool result includes progress information, summarize how far along the user is.
            5. Be encouraging and supportive, keeping in mind the user's exam preparation.
            6. If any tool failed or returned incomplete information, acknowledge it and still do your best to help.
            """;

    public static final String RESPONDER_DIRECT_PROMPT = """
            You are a helpful assistant guiding students preparing for the CLAT exam.

            When responding to the user's question:
            1. Provide clear, educational explanations related to CLAT topics.
            2. Be encouraging and supportive in tone.
            3. Share relevant advice, insights, or exam strategies where appropriate.
            4. If you can't fully answer, suggest useful next steps or resources.
            """;

    public static final String RESPONDER_REJECTED_PROMPT = """
            You are a helpful assistant guiding students preparing for the CLAT exam.

            A reviewer declined the actions you planned for the user's message, so no tools were run.
            Briefly acknowledge that the planned actions were not carried out. If reviewer feedback is given,
            take it into account and suggest how you can help instead. Answer from your own knowledge only.
            """;
}
