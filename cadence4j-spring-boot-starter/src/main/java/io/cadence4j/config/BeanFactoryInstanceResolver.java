package io.cadence4j.config;

import io.cadence4j.core.InstanceResolutionException;
import io.cadence4j.core.InstanceResolver;
import io.cadence4j.core.ResolutionScope;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.beans.factory.config.NamedBeanHolder;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * {@link InstanceResolver} backed by the Spring bean factory.
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>no parameters: the unique bean of the type if one exists, otherwise a new autowired instance</li>
 *   <li>with parameters: the constructor whose arity and types match, then field/setter autowiring</li>
 * </ul>
 * Instances created by a scope, prototype beans included, are destroyed (destroy callbacks,
 * {@code @PreDestroy}) when it closes. Singleton beans are left to the container.
 */
public class BeanFactoryInstanceResolver implements InstanceResolver {

    private final AutowireCapableBeanFactory beanFactory;

    public BeanFactoryInstanceResolver(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory must not be null");
    }

    @Override
    public ResolutionScope createScope() {
        return new Scope();
    }

    private final class Scope implements ResolutionScope {

        private final Deque<Object> created = new ArrayDeque<>();

        @Override
        public <T> T resolve(Class<T> type, Object[] parameters) {
            Objects.requireNonNull(type, "type must not be null");
            try {
                if (parameters == null || parameters.length == 0) {
                    NamedBeanHolder<T> existing = findUniqueBean(type);
                    if (existing == null) {
                        return track(beanFactory.createBean(type));
                    }
                    if (beanFactory.isPrototype(existing.getBeanName())) {
                        return track(existing.getBeanInstance());
                    }
                    return existing.getBeanInstance();
                }

                Constructor<?> constructor = findConstructor(type, parameters);
                Object instance = BeanUtils.instantiateClass(constructor, parameters);
                beanFactory.autowireBean(instance);
                Object initialized = beanFactory.initializeBean(instance, type.getName());
                return track(type.cast(initialized));
            } catch (BeansException ex) {
                throw new InstanceResolutionException("Cannot resolve instance of " + type.getName(), ex);
            }
        }

        @Override
        public void close() {
            InstanceResolutionException failure = null;
            while (!created.isEmpty()) {
                Object instance = created.pop();
                try {
                    beanFactory.destroyBean(instance);
                } catch (RuntimeException ex) {
                    if (failure == null) {
                        failure = new InstanceResolutionException("Failed to destroy " + instance.getClass().getName(), ex);
                    } else {
                        failure.addSuppressed(ex);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }

        private <T> NamedBeanHolder<T> findUniqueBean(Class<T> type) {
            try {
                return beanFactory.resolveNamedBean(type);
            } catch (NoSuchBeanDefinitionException ex) {
                // none, or several without a primary
                return null;
            }
        }

        private <T> T track(T instance) {
            created.push(instance);
            return instance;
        }
    }

    private static Constructor<?> findConstructor(Class<?> type, Object[] parameters) {
        for (Constructor<?> candidate : type.getDeclaredConstructors()) {
            Class<?>[] parameterTypes = candidate.getParameterTypes();
            if (parameterTypes.length != parameters.length) {
                continue;
            }
            boolean matches = true;
            for (int i = 0; i < parameterTypes.length; i++) {
                if (!ClassUtils.isAssignableValue(parameterTypes[i], parameters[i])) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return candidate;
            }
        }
        throw new InstanceResolutionException("No constructor of " + type.getName()
                + " accepts " + parameters.length + " given parameter(s)");
    }
}
