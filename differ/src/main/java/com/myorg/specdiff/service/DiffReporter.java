package com.myorg.specdiff.service;

import com.myorg.specdiff.model.DiffResult;

public interface DiffReporter {

    void report(DiffResult result);
}
