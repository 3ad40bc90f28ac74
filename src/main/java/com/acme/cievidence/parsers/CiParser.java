/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.CiPlatform;

import java.nio.file.Path;

/**
 * Reads one CI configuration file and reports the test steps it declares.
 *
 * <p>Implementations never throw for bad content: a file that cannot be understood
 * yields {@link ParseOutcome.Malformed}, a file that is not there yields
 * {@link ParseOutcome.NotFound}. Parsing the same file twice gives equal outcomes.
 */
public interface CiParser {
    CiPlatform platform();
    ParseOutcome parse(Path configFile);
}
