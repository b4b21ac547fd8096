package ir.sahab.rpcnetwork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A JSON-RPC request which a service answers once it is live. The orchestration code never sends or interprets these
 * requests; it only hands the request of each dependency to the services depending on it, so their bootstrap logic can
 * poll the dependency before declaring itself live.
 */
public class JsonRpcRequest {

    private final String method;
    private final Map<String, Object> params;

    public JsonRpcRequest(String method) {
        this(method, Collections.emptyMap());
    }

    /**
     * @param method the JSON-RPC method name, required.
     * @param params named parameters of the call, kept in the given order.
     */
    public JsonRpcRequest(String method, Map<String, Object> params) {
        Validate.notEmpty(method, "Method can not be empty");
        Validate.notNull(params, "Params can not be null, use an empty map instead");

        this.method = method;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonRpcRequest)) {
            return false;
        }
        JsonRpcRequest other = (JsonRpcRequest) obj;
        return new EqualsBuilder()
                .append(method, other.method)
                .append(params, other.params)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(method)
                .append(params)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("method", method)
                .append("params", params)
                .toString();
    }
}
