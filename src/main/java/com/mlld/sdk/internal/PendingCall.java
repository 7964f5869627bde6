package com.mlld.sdk.internal;

import com.mlld.sdk.transport.ResponseChannel;
import com.mlld.sdk.transport.Transport;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A request that has been registered and sent: its id, the session it went out
 * on, and the channel its replies arrive on.
 */
@Getter
@AllArgsConstructor
public final class PendingCall {
    private final long requestId;
    private final Transport transport;
    private final ResponseChannel channel;
}
