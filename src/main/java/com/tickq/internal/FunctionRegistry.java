package com.tickq.internal;

import com.fasterxml.jackson.databind.ObjectReader;
import com.tickq.JobContext;
import com.tickq.JobFunction;
import com.tickq.JobPriority;
import com.tickq.annotation.TickerFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps function names to handlers. Built once after all singletons exist and never modified afterwards.
 */
@Component
public class FunctionRegistry implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final ListableBeanFactory beanFactory;
    private final PayloadCodec payloadCodec;

    private volatile Map<String, RegisteredFunction> functions = Map.of();

    public FunctionRegistry(ListableBeanFactory beanFactory, PayloadCodec payloadCodec) {
        this.beanFactory = beanFactory;
        this.payloadCodec = payloadCodec;
    }

    /**
     * Builds a registry directly from handler instances, outside of an application context.
     */
    public static FunctionRegistry of(PayloadCodec payloadCodec, Object... beans) {
        FunctionRegistry registry = new FunctionRegistry(null, payloadCodec);
        registry.register(Arrays.asList(beans));
        return registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        List<Object> beans = new ArrayList<>(beanFactory.getBeansOfType(JobFunction.class).values());
        for (Object bean : beanFactory.getBeansWithAnnotation(TickerFunction.class).values()) {
            if (!(bean instanceof JobFunction<?>)) {
                beans.add(bean);
            }
        }
        register(beans);
    }

    private void register(Collection<?> beans) {
        Map<String, RegisteredFunction> registrations = new LinkedHashMap<>();
        for (Object bean : beans) {
            if (bean instanceof JobFunction<?> function) {
                registerJobFunction(registrations, function);
            } else {
                registerAnnotatedBean(registrations, bean);
            }
        }
        this.functions = Map.copyOf(registrations);
        log.info("Function registry initialized with {} functions: {}", functions.size(), functions.keySet());
    }

    public Optional<RegisteredFunction> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    /**
     * @throws IllegalArgumentException when no handler is registered under {@code name}
     */
    public RegisteredFunction require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "No function registered under name '" + name + "'. Known functions: " + functions.keySet()));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Set<String> names() {
        return functions.keySet();
    }

    public Collection<RegisteredFunction> all() {
        return functions.values();
    }

    private void registerJobFunction(Map<String, RegisteredFunction> registrations, JobFunction<?> function) {
        String name = function.getFunctionName();
        TickerFunction annotation = findAnnotation(function);
        PayloadDeserializer deserializer = payloadDeserializerFor(function.getPayloadClass());
        FunctionInvoker invoker = (context, payload) -> invokeFunction(function, context, payload);
        registerFunction(registrations, name, annotation, deserializer, invoker,
                "JobFunction bean " + ClassUtils.getUserClass(function).getName());
    }

    private void registerAnnotatedBean(Map<String, RegisteredFunction> registrations, Object bean) {
        TickerFunction annotation = findAnnotation(bean);
        if (annotation == null) {
            return;
        }
        String name = annotation.value() == null ? "" : annotation.value().trim();
        if (name.isEmpty()) {
            throw new IllegalStateException(
                    "@TickerFunction value must not be blank on " + ClassUtils.getUserClass(bean).getName());
        }
        Method executeMethod = resolveExecuteMethod(bean, annotation);
        Class<?> payloadClass = resolvePayloadClass(annotation, executeMethod);
        registerFunction(registrations, name, annotation, payloadDeserializerFor(payloadClass),
                createExecuteInvoker(bean, executeMethod),
                "@TickerFunction bean " + ClassUtils.getUserClass(bean).getName());
    }

    private void registerFunction(
            Map<String, RegisteredFunction> registrations,
            String name,
            TickerFunction annotation,
            PayloadDeserializer deserializer,
            FunctionInvoker invoker,
            String source) {
        String cron = null;
        if (annotation != null && annotation.cron() != null && !annotation.cron().isBlank()) {
            cron = annotation.cron().trim();
            try {
                CronExpression.parse(cron);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Invalid cron expression '" + cron + "' for function '" + name + "'", e);
            }
        }
        JobPriority priority = annotation == null ? JobPriority.NORMAL : annotation.priority();
        RegisteredFunction existing = registrations.putIfAbsent(name,
                new RegisteredFunction(name, priority, cron, deserializer, invoker));
        if (existing != null) {
            throw new IllegalStateException("Duplicate function name '" + name + "' detected while registering "
                    + source + ". Each function name must be unique.");
        }
    }

    private Method resolveExecuteMethod(Object bean, TickerFunction annotation) {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        List<Method> executeMethods = Arrays.stream(ReflectionUtils.getAllDeclaredMethods(targetClass))
                .filter(method -> method.getName().equals("execute"))
                .filter(method -> !Modifier.isStatic(method.getModifiers()))
                .filter(method -> !method.isBridge() && !method.isSynthetic())
                .toList();

        if (executeMethods.isEmpty()) {
            throw new IllegalStateException(
                    "@TickerFunction bean " + targetClass.getName() + " must declare a non-static execute(...) method.");
        }

        Class<?> configuredPayload = annotation.payload();
        if (configuredPayload != Void.class) {
            Method withContext = findUniqueMethod(executeMethods,
                    method -> method.getParameterCount() == 2
                            && method.getParameterTypes()[0] == JobContext.class
                            && method.getParameterTypes()[1].isAssignableFrom(configuredPayload),
                    targetClass, "(JobContext, " + configuredPayload.getSimpleName() + ")");
            if (withContext != null) {
                return withContext;
            }
            Method payloadOnly = findUniqueMethod(executeMethods,
                    method -> method.getParameterCount() == 1
                            && method.getParameterTypes()[0] != JobContext.class
                            && method.getParameterTypes()[0].isAssignableFrom(configuredPayload),
                    targetClass, "(" + configuredPayload.getSimpleName() + ")");
            if (payloadOnly != null) {
                return payloadOnly;
            }
            throw new IllegalStateException("@TickerFunction bean " + targetClass.getName() + " declares payload "
                    + configuredPayload.getName() + " but no matching execute(...) method was found.");
        }

        Method withContext = findUniqueMethod(executeMethods,
                method -> method.getParameterCount() == 2 && method.getParameterTypes()[0] == JobContext.class,
                targetClass, "(JobContext, Payload)");
        if (withContext != null) {
            return withContext;
        }
        Method contextOnly = findUniqueMethod(executeMethods,
                method -> method.getParameterCount() == 1 && method.getParameterTypes()[0] == JobContext.class,
                targetClass, "(JobContext)");
        if (contextOnly != null) {
            return contextOnly;
        }
        Method payloadOnly = findUniqueMethod(executeMethods,
                method -> method.getParameterCount() == 1 && method.getParameterTypes()[0] != JobContext.class,
                targetClass, "(Payload)");
        if (payloadOnly != null) {
            return payloadOnly;
        }
        Method noArgs = findUniqueMethod(executeMethods, method -> method.getParameterCount() == 0,
                targetClass, "()");
        if (noArgs != null) {
            return noArgs;
        }

        throw new IllegalStateException("@TickerFunction bean " + targetClass.getName()
                + " has no supported execute(...) signature. Supported: execute(), execute(JobContext),"
                + " execute(Payload), execute(JobContext, Payload).");
    }

    private Method findUniqueMethod(List<Method> methods, Predicate<Method> matcher, Class<?> targetClass,
            String signatureDescription) {
        List<Method> matches = methods.stream().filter(matcher).toList();
        if (matches.isEmpty()) {
            return null;
        }
        if (matches.size() > 1) {
            throw new IllegalStateException("Ambiguous method overloads on " + targetClass.getName()
                    + " for signature " + signatureDescription + ". Keep exactly one matching method.");
        }
        Method selected = matches.get(0);
        ReflectionUtils.makeAccessible(selected);
        return selected;
    }

    private Class<?> resolvePayloadClass(TickerFunction annotation, Method executeMethod) {
        if (annotation.payload() != Void.class) {
            return annotation.payload();
        }
        Class<?>[] parameterTypes = executeMethod.getParameterTypes();
        if (parameterTypes.length == 2) {
            return parameterTypes[1];
        }
        if (parameterTypes.length == 1 && parameterTypes[0] != JobContext.class) {
            return parameterTypes[0];
        }
        return Void.class;
    }

    private PayloadDeserializer payloadDeserializerFor(Class<?> payloadClass) {
        if (payloadClass == null || payloadClass == Void.class) {
            return rawPayload -> null;
        }
        ObjectReader reader = payloadCodec.readerFor(payloadClass);
        return rawPayload -> payloadCodec.decode(rawPayload, reader);
    }

    private FunctionInvoker createExecuteInvoker(Object bean, Method executeMethod) {
        int parameterCount = executeMethod.getParameterCount();
        if (parameterCount == 0) {
            return (context, payload) -> invokeReflectively(bean, executeMethod);
        }
        if (parameterCount == 1) {
            if (executeMethod.getParameterTypes()[0] == JobContext.class) {
                return (context, payload) -> invokeReflectively(bean, executeMethod, context);
            }
            return (context, payload) -> invokeReflectively(bean, executeMethod, payload);
        }
        return (context, payload) -> invokeReflectively(bean, executeMethod, context, payload);
    }

    private void invokeReflectively(Object bean, Method method, Object... args) throws Exception {
        try {
            method.invoke(bean, args);
        } catch (InvocationTargetException invocationTargetException) {
            Throwable target = invocationTargetException.getTargetException();
            if (target instanceof Exception ex) {
                throw ex;
            }
            if (target instanceof Error error) {
                throw error;
            }
            throw new RuntimeException(target);
        }
    }

    private void invokeFunction(JobFunction<?> function, JobContext context, Object payload) throws Exception {
        @SuppressWarnings("unchecked")
        JobFunction<Object> castFunction = (JobFunction<Object>) function;
        castFunction.execute(context, payload);
    }

    private TickerFunction findAnnotation(Object bean) {
        return AnnotationUtils.findAnnotation(ClassUtils.getUserClass(bean), TickerFunction.class);
    }

    @FunctionalInterface
    public interface FunctionInvoker {
        void invoke(JobContext context, Object payload) throws Exception;
    }

    @FunctionalInterface
    public interface PayloadDeserializer {
        Object deserialize(byte[] rawPayload) throws Exception;
    }

    /**
     * @param cron the validated expression declared on {@link TickerFunction#cron()}, or {@code null}
     */
    public record RegisteredFunction(
            String name,
            JobPriority priority,
            String cron,
            PayloadDeserializer payloadDeserializer,
            FunctionInvoker invoker) {
    }
}
