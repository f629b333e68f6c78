package dk.cloudcreate.eventcore.common.reflection;

import java.lang.annotation.Annotation;
import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Invokes the method, annotated with a given annotation, whose first parameter type best matches an argument's type.<br>
 * Candidate methods may be private and may be declared in super classes. They take one parameter, or two
 * where the second parameter receives the optional context argument passed to {@link #invoke(Object, Object, Object)}.<br>
 * When several methods match, the one with the most specific first parameter type wins.
 */
public final class AnnotatedMethodInvoker {
    private final Class<?>                            invokeOnType;
    private final Class<? extends Annotation>         annotationType;
    private final List<Method>                        candidateMethods;
    private final ConcurrentMap<Class<?>, Optional<Method>> resolvedMethods = new ConcurrentHashMap<>();

    public AnnotatedMethodInvoker(Class<?> invokeOnType, Class<? extends Annotation> annotationType) {
        this.invokeOnType = Objects.requireNonNull(invokeOnType, "No invokeOnType provided");
        this.annotationType = Objects.requireNonNull(annotationType, "No annotationType provided");
        this.candidateMethods = findCandidateMethods();
    }

    private List<Method> findCandidateMethods() {
        var methods = new ArrayList<Method>();
        Class<?> type = invokeOnType;
        while (type != null && type != Object.class) {
            for (var method : type.getDeclaredMethods()) {
                if (method.isAnnotationPresent(annotationType) && !Modifier.isStatic(method.getModifiers())) {
                    if (method.getParameterCount() < 1 || method.getParameterCount() > 2) {
                        throw new IllegalArgumentException(msg("Method '{}' in '{}' annotated with @{} must have one or two parameters",
                                                               method.getName(),
                                                               type.getName(),
                                                               annotationType.getSimpleName()));
                    }
                    method.setAccessible(true);
                    methods.add(method);
                }
            }
            type = type.getSuperclass();
        }
        return List.copyOf(methods);
    }

    /**
     * @return all annotated methods found on the type and its super classes
     */
    public List<Method> candidateMethods() {
        return candidateMethods;
    }

    public boolean hasMatchingMethod(Class<?> argumentType) {
        return resolveMethod(argumentType).isPresent();
    }

    /**
     * Resolve the best matching method for the given argument type
     *
     * @param argumentType the argument type
     * @return the matching method or {@link Optional#empty()}
     */
    public Optional<Method> resolveMethod(Class<?> argumentType) {
        Objects.requireNonNull(argumentType, "No argumentType provided");
        return resolvedMethods.computeIfAbsent(argumentType, type -> {
            Method bestMatch = null;
            for (var method : candidateMethods) {
                var parameterType = method.getParameterTypes()[0];
                if (parameterType.isAssignableFrom(type) &&
                        (bestMatch == null || bestMatch.getParameterTypes()[0].isAssignableFrom(parameterType))) {
                    bestMatch = method;
                }
            }
            return Optional.ofNullable(bestMatch);
        });
    }

    /**
     * Invoke the best matching method on <code>invokeOn</code>
     *
     * @param invokeOn        the object to invoke the method on
     * @param argument        the argument whose type selects the method
     * @param contextArgument passed as second argument to methods that declare two parameters (may be null)
     * @return true if a method matched and was invoked, false if no method matched
     * @throws MethodInvocationException if the invoked method threw a checked exception. Unchecked exceptions are rethrown as is
     */
    public boolean invoke(Object invokeOn, Object argument, Object contextArgument) {
        Objects.requireNonNull(invokeOn, "No invokeOn provided");
        Objects.requireNonNull(argument, "No argument provided");
        var method = resolveMethod(argument.getClass());
        if (method.isEmpty()) {
            return false;
        }
        try {
            if (method.get().getParameterCount() == 1) {
                method.get().invoke(invokeOn, argument);
            } else {
                method.get().invoke(invokeOn, argument, contextArgument);
            }
            return true;
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new MethodInvocationException(msg("Method '{}' in '{}' failed", method.get().getName(), invokeOnType.getName()), cause);
        } catch (IllegalAccessException e) {
            throw new MethodInvocationException(msg("Couldn't invoke method '{}' in '{}'", method.get().getName(), invokeOnType.getName()), e);
        }
    }
}
