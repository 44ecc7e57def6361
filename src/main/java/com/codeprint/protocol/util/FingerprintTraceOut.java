package com.codeprint.protocol.util;

import com.codeprint.debug.Debug;

/** Echoes every hashing token to the Debug hub at TRACE level. */
public final class FingerprintTraceOut implements FingerprintTrace {

    public static final String TAG = "codeprint.fingerprint";

    @Override
    public void step(String token) {
        Debug.get().t(TAG, token);
    }
}
