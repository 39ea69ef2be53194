package io.github.cyfko.zapformat.core.ast;

/**
 * Properties of an {@code event} block. Absent keys are {@code null}; nothing is defaulted.
 *
 * @param from the sending side, usually {@code Client} or {@code Server}
 * @param type the delivery type, usually {@code Reliable} or {@code Unreliable}
 * @param call the call style ({@code SingleSync}, {@code SingleAsync}, {@code ManySync},
 *             {@code ManyAsync} or {@code Polling})
 * @param data the payload type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EventProperties(String from, String type, String call, TypeNode data) {

    /**
     * @return a properties record with every key absent
     */
    public static EventProperties empty() {
        return new EventProperties(null, null, null, null);
    }
}
