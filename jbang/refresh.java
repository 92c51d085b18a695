///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS org.springaicommunity:dependency-updater-cli:1.0.0-SNAPSHOT

import org.springaicommunity.dependency.updater.cli.DependencyUpdaterCli;

public class refresh {
    public static void main(String[] args) throws Exception {
        DependencyUpdaterCli.main(args);
    }
}
