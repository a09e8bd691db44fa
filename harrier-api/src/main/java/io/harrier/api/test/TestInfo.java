package io.harrier.api.test;

/**
 * Identity of a registered test.
 *
 * @param module       module path the test belongs to
 * @param function     function (method) name
 * @param variant      parameter variant index, 0 for plain tests
 * @param displayName  name shown in reports; includes the case label for parameterized variants
 */
public record TestInfo(String module, String function, int variant, String displayName) {

    /**
     * @return {@code module::displayName}
     */
    public String fullName() {
        return module + "::" + displayName;
    }

    /**
     * @return {@code project::module::displayName}
     */
    public String uniqueName(String project) {
        return project + "::" + fullName();
    }
}
