package io.spiderq.worker;

import io.spiderq.model.WorkerEvent;
import io.spiderq.model.WorkerEventType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class WorkerEventsTest {

    @Test
    void parsesTypedFields() {
        WorkerEvent progress = WorkerEvents.parse("{\"type\":\"progress\",\"current\":2,\"total\":5,\"title\":\"t\"}")
                .orElseThrow();
        Assertions.assertEquals(WorkerEventType.PROGRESS, progress.type());
        Assertions.assertEquals(2, progress.current());
        Assertions.assertEquals(5, progress.total());
        Assertions.assertEquals("t", progress.title());

        WorkerEvent done = WorkerEvents.parse(
                "{\"type\":\"done\",\"count\":3,\"files\":[\"a.xlsx\"],\"api_success\":false,\"api_message\":\"code=-1\"}")
                .orElseThrow();
        Assertions.assertEquals(3, done.count());
        Assertions.assertEquals(List.of("a.xlsx"), done.files());
        Assertions.assertEquals(Boolean.FALSE, done.apiSuccess());
        Assertions.assertEquals("code=-1", done.apiMessage());

        WorkerEvent validation = WorkerEvents.parse(
                "{\"type\":\"validation_result\",\"valid\":true,\"message\":\"ok\",\"userInfo\":{\"nickname\":\"n\"}}")
                .orElseThrow();
        Assertions.assertEquals(Boolean.TRUE, validation.valid());
        Assertions.assertEquals("n", validation.userInfo().path("nickname").asText());
    }

    @Test
    void keepsTheWholeFrameAsBody() {
        WorkerEvent media = WorkerEvents.parse("{\"type\":\"media\",\"noteId\":\"n1\",\"action\":\"saved\"}")
                .orElseThrow();
        Assertions.assertEquals(WorkerEventType.MEDIA, media.type());
        Assertions.assertEquals("n1", media.body().path("noteId").asText());
    }

    @Test
    void dropsMalformedAndUnknownFrames() {
        Assertions.assertTrue(WorkerEvents.parse("not json").isEmpty());
        Assertions.assertTrue(WorkerEvents.parse("[1,2]").isEmpty());
        Assertions.assertTrue(WorkerEvents.parse("{\"message\":\"no type\"}").isEmpty());
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"telemetry\"}").isEmpty());
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"exit\"}").isEmpty());
    }

    @Test
    void dropsCountersThatAreNotIntegers() {
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"done\",\"count\":3000000000}").isEmpty());
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"progress\",\"current\":1.5,\"total\":2}").isEmpty());
        Assertions.assertEquals(Integer.MAX_VALUE, WorkerEvents.parse(
                "{\"type\":\"done\",\"count\":2147483647}").orElseThrow().count());
    }

    @Test
    void recognizesAccountAnomalies() {
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"done\",\"count\":1,\"api_success\":false}")
                .orElseThrow().isAccountAnomaly());
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"done\",\"count\":1,\"api_message\":\"账号异常\"}")
                .orElseThrow().isAccountAnomaly());
        Assertions.assertTrue(WorkerEvents.parse("{\"type\":\"done\",\"api_message\":\"request failed code=-1\"}")
                .orElseThrow().isAccountAnomaly());
        Assertions.assertFalse(WorkerEvents.parse("{\"type\":\"done\",\"count\":1,\"api_message\":\"ok\"}")
                .orElseThrow().isAccountAnomaly());
        Assertions.assertFalse(WorkerEvents.parse("{\"type\":\"error\",\"message\":\"code=-1\",\"api_success\":false}")
                .orElseThrow().isAccountAnomaly());
    }
}
