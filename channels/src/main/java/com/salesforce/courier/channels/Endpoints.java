/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels;

import static java.util.Objects.requireNonNull;

/**
 * The two handles of a freshly created channel
 *
 * @author hal.hildebrand
 *
 */
public record Endpoints<S extends AutoCloseable, R extends AutoCloseable>(S sender, R receiver)
                       implements AutoCloseable {

    public Endpoints {
        requireNonNull(sender, "sender");
        requireNonNull(receiver, "receiver");
    }

    /**
     * Close both handles, sender first
     */
    @Override
    public void close() throws Exception {
        try {
            sender.close();
        } finally {
            receiver.close();
        }
    }
}
