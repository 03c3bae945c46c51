package com.eainde.monitor.search.eap;

import lombok.Builder;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A public search column and where it lives in storage.
 *
 * @param publicAlias  name used in queries; {@code p95() as foo} has the alias {@code foo}
 * @param internalName RPC column name
 * @param searchType   public type
 * @param internalType RPC type, {@code null} to derive it from the search type
 * @param processor    post-processing applied to result values, optional
 * @param validator    check applied to query values, optional
 */
@Builder
public record ResolvedColumn(
        String publicAlias,
        String internalName,
        SearchType searchType,
        AttributeType internalType,
        Function<Object, Object> processor,
        Predicate<Object> validator) {

    public ResolvedColumn {
        Objects.requireNonNull(publicAlias, "publicAlias");
        Objects.requireNonNull(internalName, "internalName");
        Objects.requireNonNull(searchType, "searchType");
    }

    /**
     * @throws InvalidSearchQueryException when the validator rejects the value
     */
    public void validate(Object value) {
        if (validator != null && !validator.test(value)) {
            throw new InvalidSearchQueryException(value + " is an invalid value for " + publicAlias);
        }
    }

    public Object process(Object value) {
        return processor == null ? value : processor.apply(value);
    }

    public AttributeKey protoDefinition() {
        return new AttributeKey(internalName,
                internalType != null ? internalType : searchType.defaultAttributeType());
    }
}
