package dev.pekelund.billsplit;

import org.springframework.modulith.Modulithic;

/**
 * Anchor type for the settlement engine's application modules.
 */
@Modulithic(systemName = "billsplit-core")
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
