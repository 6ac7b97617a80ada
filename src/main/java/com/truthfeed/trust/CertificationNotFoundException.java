package com.truthfeed.trust;

import com.truthfeed.feed.NotFoundException;

public class CertificationNotFoundException extends NotFoundException {

    public CertificationNotFoundException(String certificationId) {
        super("certification not found: " + certificationId);
    }
}
