package me.golemcore.gurgeh.security;

import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandDenylistTest {

    private CommandDenylist denylist;

    @BeforeEach
    void setUp() {
        denylist = new CommandDenylist(new AgentProperties());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "rm -rf /",
            "rm -rf /*",
            "sudo rm -fr / --no-preserve-root",
            "mkfs.ext4 /dev/sda1",
            "dd if=/dev/zero of=/dev/sda bs=1M",
            "cat image.bin > /dev/nvme0n1",
            "chmod -R 777 /",
            "chown -R nobody /",
            ":(){ :|:& };:",
            "rm -rf /home/user",
            "cd /projects && rm -r /etc",
            "rm -rf ~/documents",
            "rm --recursive $HOME/cache",
            "rm -rf /projects/../etc",
            "rm -rf ../../etc",
            "rm -rf ../../../home",
            "rm -rf ..",
            "cd / && rm -rf etc",
            "cd .. && rm -r projects",
            "cd .. ; rm -r -f self",
            "cd && rm -rf cache",
            "cd $TARGET && rm -rf build",
            "(cd /var && rm -rf log)",
            "rm -rf \"$DIR\"",
            "/bin/rm -r ../../usr",
            "rm -rf -- ../../etc"
    })
    void shouldBlockDestructiveCommands(String command) {
        Optional<String> violation = denylist.findViolation(command);

        assertTrue(violation.isPresent(), "expected block for: " + command);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "ls -la /",
            "echo hello > /projects/out.txt",
            "rm notes.txt",
            "rm -rf /projects/old-build",
            "rm -r build/",
            "npm install && npm test",
            "chmod 644 /public/index.html",
            "grep -r TODO /projects",
            "rm -rf ./dist",
            "cd site && rm -rf node_modules",
            "cd /public && rm -r images/old",
            "rm -rf ../projects/cache",
            "make 2>&1 | tee build.log"
    })
    void shouldAllowOrdinaryCommands(String command) {
        Optional<String> violation = denylist.findViolation(command);

        assertFalse(violation.isPresent(), "unexpected block for: " + command);
    }

    @Test
    void shouldIgnoreBlankCommand() {
        assertFalse(denylist.findViolation(null).isPresent());
        assertFalse(denylist.findViolation("   ").isPresent());
    }

    @Test
    void shouldResolveRelativeTargetsAgainstGivenWorkingDirectory() {
        assertFalse(denylist.findViolation("rm -rf ../drafts", "/public/site").isPresent());
        assertTrue(denylist.findViolation("rm -rf ../..", "/public/site").isPresent());
        assertTrue(denylist.findViolation("rm -rf ../../../..", "/projects/app").isPresent());
    }

    @Test
    void shouldRejectRecursiveDeleteOnceCdLeavesZones() {
        Optional<String> violation = denylist.findViolation("cd ../.. && rm -rf projects", "/projects/app");

        assertTrue(violation.isPresent());
        assertTrue(violation.get().startsWith("recursive delete after leaving writable zones"));
    }
}
