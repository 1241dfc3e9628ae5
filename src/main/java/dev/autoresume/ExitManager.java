package dev.autoresume;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ends the CLI process with the run's exit status. Under a test runner the
 * status is only logged, so a test never terminates the JVM.
 */
@Slf4j
@Component
public class ExitManager {

    /** Resume written, or selection aborted by the user. */
    public static final int SUCCESS = 0;
    /** Any stage failed. */
    public static final int FAILURE = 1;

    public void exit(int status) {
        if (runningUnderTests()) {
            log.debug("Not exiting the test runner (status {})", status);
            return;
        }
        System.exit(status);
    }

    protected boolean runningUnderTests() {
        String classPath = System.getProperty("java.class.path", "");
        return classPath.contains("junit") || classPath.contains("surefire");
    }
}
