package work.lcod.twine.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var implementationVersion = TwineRunCommand.class.getPackage().getImplementationVersion();
        return new String[] {
            "twine-run (java) " + (implementationVersion != null ? implementationVersion : "development"),
            "JVM " + Runtime.version()
        };
    }
}
