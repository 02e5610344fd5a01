package com.xendex.backend.enums;

public enum CallToAction {
    REPLY("Reply if this is relevant"),
    REPLY_YES_NO("A simple yes or no works"),
    RESOURCE("Happy to send over the write-up");

    private final String prompt;

    CallToAction(String prompt) {
        this.prompt = prompt;
    }

    public String getPrompt() {
        return prompt;
    }
}
