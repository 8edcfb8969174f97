package com.router.reasoning;

/**
 * Declares one reasoning task: what the model is asked to do and which record it must answer with.
 *
 * @param name         short task name, used in logs
 * @param instructions the task description sent as system prompt
 * @param outputFormat a JSON skeleton of the expected answer, appended to the instructions
 * @param outputType   the record the answer is read into
 * @param <I>          input record type
 * @param <O>          output record type
 */
public record Signature<I, O>(String name, String instructions, String outputFormat, Class<O> outputType) {
}
