package dev.personalagent.services.profile;

import com.google.inject.Singleton;
import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelProfile;

/**
 * Used in offline mode: every valid profile "connects" instantly.
 */
@Singleton
public class OfflineConnectionTester implements ConnectionTester {

    @Override
    public ConnectionTestResult test(ModelProfile profile) {
        return profile.validate().isEmpty()
                ? ConnectionTestResult.ok(0)
                : ConnectionTestResult.failed(String.join("; ", profile.validate()));
    }
}
