package dev.parsero.sample;

/**
 * Minimal text-completion client used by the bundled sample agents.
 */
@FunctionalInterface
public interface TextModel {

    String complete(String prompt);
}
