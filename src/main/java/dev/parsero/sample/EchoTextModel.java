package dev.parsero.sample;

/**
 * Offline stand-in for a language model: answers every prompt with the prompt itself.
 * Lets the samples run from the command line without network access.
 */
public final class EchoTextModel implements TextModel {

    @Override
    public String complete(String prompt) {
        return "(echo) " + prompt;
    }
}
