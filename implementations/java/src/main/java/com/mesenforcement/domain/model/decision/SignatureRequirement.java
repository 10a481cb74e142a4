package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.SignatureLevel;
import lombok.Value;

@Value
public class SignatureRequirement {
    boolean required;
    SignatureLevel signatureLevel;

    /** True when a site-specific row decided, false for the global row or no row. */
    boolean siteSpecific;

    public static SignatureRequirement notRequired() {
        return new SignatureRequirement(false, null, false);
    }
}
