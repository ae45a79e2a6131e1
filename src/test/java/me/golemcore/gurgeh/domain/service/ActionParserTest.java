package me.golemcore.gurgeh.domain.service;

import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.ActionKind;
import me.golemcore.gurgeh.domain.model.DelegationTaskType;
import me.golemcore.gurgeh.domain.model.WriteMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionParserTest {

    private ActionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ActionParser();
    }

    @Test
    void shouldParseActionsInOrder() {
        String text = """
                I have been thinking about my next steps.

                <action type="think">Reflect on the inbox first.</action>
                <action type="write" path="/self/journal.md" mode="append">
                Day three. Quiet.
                </action>
                <action type="serve" path="/public/index.html"><html><body>hi</body></html></action>
                """;

        List<Action> actions = parser.parse(text);

        assertEquals(3, actions.size());
        assertEquals(ActionKind.THINK, actions.get(0).kind());
        Action.Write write = assertInstanceOf(Action.Write.class, actions.get(1));
        assertEquals("/self/journal.md", write.path());
        assertEquals(WriteMode.APPEND, write.mode());
        assertEquals("Day three. Quiet.", write.content());
        Action.Serve serve = assertInstanceOf(Action.Serve.class, actions.get(2));
        assertEquals("<html><body>hi</body></html>", serve.content());
    }

    @Test
    void shouldDefaultWriteModeToOverwrite() {
        List<Action> actions = parser.parse("<action type=\"write\" path=\"/self/a.md\">x</action>");

        Action.Write write = assertInstanceOf(Action.Write.class, actions.get(0));
        assertEquals(WriteMode.OVERWRITE, write.mode());
    }

    @Test
    void shouldSkipUnknownTypes() {
        List<Action> actions = parser.parse("""
                <action type="teleport">somewhere</action>
                <action type="checkpoint" label="before-refactor"></action>
                """);

        assertEquals(1, actions.size());
        Action.Checkpoint checkpoint = assertInstanceOf(Action.Checkpoint.class, actions.get(0));
        assertEquals("before-refactor", checkpoint.effectiveLabel());
    }

    @Test
    void shouldParseExecuteAttributes() {
        List<Action> actions = parser.parse(
                "<action type=\"execute\" timeout=\"60000\" workingDir=\"/projects/site\">npm test</action>");

        Action.Execute execute = assertInstanceOf(Action.Execute.class, actions.get(0));
        assertEquals("npm test", execute.command());
        assertEquals(60000L, execute.timeoutMs());
        assertEquals("/projects/site", execute.workingDir());
    }

    @Test
    void shouldDropMalformedTimeout() {
        List<Action> actions = parser.parse("""
                <action type="execute" timeout="soon">make</action>
                <action type="execute" timeout="-5">make</action>
                """);

        assertEquals(2, actions.size());
        assertNull(((Action.Execute) actions.get(0)).timeoutMs());
        assertNull(((Action.Execute) actions.get(1)).timeoutMs());
    }

    @Test
    void shouldKeepEmptyExecuteForPolicyToReject() {
        List<Action> actions = parser.parse("<action type=\"execute\"></action>");

        Action.Execute execute = assertInstanceOf(Action.Execute.class, actions.get(0));
        assertNull(execute.command());
        assertTrue(execute.validationError().isPresent());
    }

    @Test
    void shouldParseDelegateTaskType() {
        List<Action> actions = parser.parse("""
                <action type="delegate" path="/projects/tool/main.py" taskType="code">Write a CLI.</action>
                <action type="delegate" path="/public/about.html">About page.</action>
                """);

        Action.Delegate code = assertInstanceOf(Action.Delegate.class, actions.get(0));
        assertEquals(DelegationTaskType.CODE, code.effectiveTaskType());
        Action.Delegate page = assertInstanceOf(Action.Delegate.class, actions.get(1));
        assertEquals(DelegationTaskType.SERVE, page.effectiveTaskType());
        assertEquals("About page.", page.brief());
    }

    @Test
    void shouldParseMessageFetchImageAndSchedule() {
        List<Action> actions = parser.parse("""
                <action type="message" to="creator">Status report.</action>
                <action type="fetch" url="https://en.wikipedia.org/wiki/Ethics"></action>
                <action type="image" path="/public/images/sun.png" aspectRatio="1:1">A sunrise</action>
                <action type="set-schedule" cron="0 */2 * * *"></action>
                """);

        assertEquals(4, actions.size());
        assertEquals("creator", ((Action.OutboundMessage) actions.get(0)).effectiveRecipient());
        assertEquals("https://en.wikipedia.org/wiki/Ethics", ((Action.Fetch) actions.get(1)).url());
        Action.Image image = (Action.Image) actions.get(2);
        assertEquals("1:1", image.aspectRatio());
        assertEquals("A sunrise", image.prompt());
        assertEquals("0 */2 * * *", ((Action.SetSchedule) actions.get(3)).effectiveCron());
    }

    @Test
    void shouldReturnEmptyForTextWithoutActions() {
        assertTrue(parser.parse("Just thinking today.").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("<action type=\"write\" path=\"/self/a.md\">unterminated").isEmpty());
    }
}
