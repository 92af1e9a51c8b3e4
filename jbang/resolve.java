///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//DEPS org.springaicommunity:release-resolver-cli:1.0.0-SNAPSHOT

import org.springaicommunity.release.resolver.cli.ReleaseResolverCli;

public class resolve {
    public static void main(String[] args) {
        ReleaseResolverCli.main(args);
    }
}
