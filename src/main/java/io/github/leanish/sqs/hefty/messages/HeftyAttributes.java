/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

/**
 * Constants for the attributes the hefty client attaches to offloaded messages.
 */
public class HeftyAttributes {

    /** Marker attribute present on every reference message sent by this client. */
    public static final String CLIENT_VERSION = "hefty-client-version";
    public static final String CLIENT_VERSION_VALUE = "v0.1";

    private HeftyAttributes() {
    }
}
