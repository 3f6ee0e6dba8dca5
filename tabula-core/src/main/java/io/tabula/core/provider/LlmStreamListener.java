package io.tabula.core.provider;

public interface LlmStreamListener {

    default void onTextDelta(int index, String text) {
    }

    /**
     * @param partialJson the next fragment of the tool input JSON; fragments are not valid JSON on their own
     */
    default void onToolInputDelta(int index, String toolUseId, String toolName, String partialJson) {
    }
}
