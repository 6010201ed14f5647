package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.namespace.ModuleNamespace;
import ai.brokk.doctest.namespace.NameResolutionException;
import ai.brokk.doctest.source.PropertyEntity;
import ai.brokk.doctest.source.SourceEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes {@code (filename, moduleName, callPath)} for doctest cases.
 *
 * <p>A case that carries the entity it was discovered on is addressed from that entity and nothing is looked up.
 * Otherwise the block name is resolved again through the namespace. A property found that way says nothing about its
 * class, so the class is resolved from the name minus its last segment and the property name is appended to the
 * class's call path. Lookup failures propagate; no fallback address is made up.
 */
public final class AddressResolver {
    private static final Logger logger = LogManager.getLogger(AddressResolver.class);

    private final ModuleNamespace namespace;

    public AddressResolver(ModuleNamespace namespace) {
        this.namespace = namespace;
    }

    public TestAddress address(DocTestCase testCase) throws AddressResolutionException {
        var entity = testCase.entity();
        if (entity != null) {
            var parent = testCase.parent();
            if (entity instanceof PropertyEntity property && parent != null) {
                return EntityAddresses.ofProperty(property, parent);
            }
            return EntityAddresses.of(entity);
        }
        return addressByName(testCase.block().name());
    }

    TestAddress addressByName(String name) throws AddressResolutionException {
        var resolved = resolve(name);
        if (!(resolved instanceof PropertyEntity property)) {
            return EntityAddresses.of(resolved);
        }

        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new AddressResolutionException(name, "Property '%s' has no owner in its name".formatted(name));
        }
        var className = name.substring(0, dot);
        logger.trace("{} is a property; addressing it through {}", name, className);
        return EntityAddresses.ofProperty(property, resolve(className));
    }

    private SourceEntity resolve(String name) throws AddressResolutionException {
        try {
            return namespace.resolveName(name);
        } catch (NameResolutionException e) {
            throw new AddressResolutionException(name, "Cannot resolve '%s': %s".formatted(name, e.getMessage()), e);
        }
    }
}
