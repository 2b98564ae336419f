package io.github.kemics.ebay;

import java.util.List;

/**
 * One error entry returned by the eBay API. Every field is optional on the wire.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/static/handling-error-messages.html</p>
 */
public record ErrorDetail(
    int errorId,
    String domain,
    String subDomain,
    String category,
    String message,
    String longMessage,
    List<String> inputRefIds,
    List<String> outputRefIds,
    List<Parameter> parameters
) {

    public ErrorDetail {
        inputRefIds = inputRefIds == null ? List.of() : List.copyOf(inputRefIds);
        outputRefIds = outputRefIds == null ? List.of() : List.copyOf(outputRefIds);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Name/value pair giving context to an error message.
     */
    public record Parameter(String name, String value) {
    }
}
