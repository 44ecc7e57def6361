import org.junit.jupiter.api.Test;

import com.codeprint.code.CodeObject;
import com.codeprint.code.ResolutionFailureException;
import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.DefaultAttributeResolver;
import com.codeprint.runtime.ScriptClass;
import com.codeprint.runtime.ScriptModule;
import com.codeprint.runtime.ScriptObject;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultAttributeResolverTest {

    private final DefaultAttributeResolver resolver = DefaultAttributeResolver.INSTANCE;

    @Test
    void moduleAttributes() {
        ScriptModule m = new ScriptModule("m").define("x", 1);
        assertEquals(1, resolver.getAttribute(m, "x"));
        assertThrows(ResolutionFailureException.class, () -> resolver.getAttribute(m, "y"));
    }

    @Test
    void instanceMethodsComeBackBound() {
        CodeFunction method = new CodeFunction(CodeObject.builder("run").build(), new LinkedHashMap<>());
        ScriptClass cls = new ScriptClass("Job").member("run", method).member("limit", 5);
        ScriptObject job = cls.newInstance().set("limit", 7);

        Object run = resolver.getAttribute(job, "run");
        assertTrue(run instanceof CodeFunction);
        assertTrue(((CodeFunction) run).isBoundMethod());
        assertSame(job, ((CodeFunction) run).receiver());

        // instance field shadows the class attribute
        assertEquals(7, resolver.getAttribute(job, "limit"));
        assertEquals(5, resolver.getAttribute(cls, "limit"));
        // on the class the function stays unbound
        assertSame(method, resolver.getAttribute(cls, "run"));
    }

    @Test
    void staticMembersOfJavaClasses() {
        assertEquals(Integer.MAX_VALUE, resolver.getAttribute(Integer.class, "MAX_VALUE"));

        Object valueOf = resolver.getAttribute(Integer.class, "valueOf");
        assertTrue(valueOf instanceof Method);
        assertEquals("valueOf", ((Method) valueOf).getName());

        assertSame(Map.Entry.class, resolver.getAttribute(Map.class, "Entry"));
    }

    @Test
    void overloadsResolveDeterministically() {
        Method first = (Method) resolver.getAttribute(String.class, "valueOf");
        Method again = (Method) resolver.getAttribute(String.class, "valueOf");
        assertEquals(first, again);
        assertEquals(1, first.getParameterCount());
    }

    @Test
    void instanceMembersOfJavaObjects() {
        Holder h = new Holder();
        assertEquals("v", resolver.getAttribute(h, "field"));
        assertTrue(resolver.getAttribute(h, "describe") instanceof Method);
        assertThrows(ResolutionFailureException.class, () -> resolver.getAttribute(h, "missing"));
    }

    @Test
    void instanceMethodIsNotAStaticAttribute() {
        assertThrows(ResolutionFailureException.class, () -> resolver.getAttribute(String.class, "length"));
    }

    @Test
    void failingClassInitializerIsAResolutionFailure() {
        ResolutionFailureException e = assertThrows(ResolutionFailureException.class,
                () -> resolver.getAttribute(BrokenStatics.class, "LIMIT"));
        assertTrue(e.getCause() instanceof LinkageError, String.valueOf(e.getCause()));
        assertTrue(e.getMessage().contains("LIMIT"), e.getMessage());
    }

    @Test
    void nullHasNoAttributes() {
        ResolutionFailureException e = assertThrows(ResolutionFailureException.class,
                () -> resolver.getAttribute(null, "x"));
        assertTrue(e.getMessage().contains("'x'"));
    }

    public static final class Holder {
        public final String field = "v";

        public String describe() {
            return "holder";
        }
    }

    public static final class BrokenStatics {
        public static final Integer LIMIT = Integer.valueOf(System.getProperty("codeprint.no.such.limit"));
    }
}
