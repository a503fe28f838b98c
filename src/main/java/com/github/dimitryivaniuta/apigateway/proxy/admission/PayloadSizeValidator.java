package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.error.PayloadTooLargeException;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/** Rejects bodies above the configured maximum, by declared Content-Length or by actual size. */
@Component
public class PayloadSizeValidator {

    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private final long maxBytes;

    public PayloadSizeValidator(GatewayProperties props) {
        this.maxBytes = props.getSecurity().getMaxPayloadBytes();
    }

    public void validate(GatewayRequest request) {
        long declared = declaredLength(request);
        if (declared > maxBytes || request.body().length > maxBytes) {
            throw tooLarge();
        }
    }

    private static long declaredLength(GatewayRequest request) {
        try {
            return request.headers().getContentLength();
        } catch (NumberFormatException e) {
            // unparseable header; the actual body size still applies
            return -1;
        }
    }

    /**
     * Reads a request body, never buffering more than one byte past the limit, so a body sent without
     * (or with a false) Content-Length is cut off as soon as it is known to be too large.
     */
    public byte[] readBody(InputStream in) throws IOException {
        int bound = maxBytes < MAX_ARRAY_LENGTH ? (int) maxBytes + 1 : MAX_ARRAY_LENGTH;
        byte[] body = in.readNBytes(bound);
        if (body.length > maxBytes) {
            throw tooLarge();
        }
        return body;
    }

    private PayloadTooLargeException tooLarge() {
        return new PayloadTooLargeException("Payload too large, limit is " + maxBytes + " bytes");
    }
}
