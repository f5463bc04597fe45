package dev.personalagent.services.profile;

import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelProfile;

/**
 * Probes whether a profile's model endpoint answers. Never throws; failures
 * are reported in the result.
 */
public interface ConnectionTester {

    ConnectionTestResult test(ModelProfile profile);
}
