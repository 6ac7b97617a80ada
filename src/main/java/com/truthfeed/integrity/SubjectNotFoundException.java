package com.truthfeed.integrity;

import com.truthfeed.feed.NotFoundException;

public class SubjectNotFoundException extends NotFoundException {

    public SubjectNotFoundException(String subjectId) {
        super("subject not found: " + subjectId);
    }
}
