package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.source.ClassEntity;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.ModuleMember;
import ai.brokk.doctest.source.PropertyEntity;
import ai.brokk.doctest.source.PythonPackages;
import ai.brokk.doctest.source.SourceEntity;
import org.jetbrains.annotations.Nullable;

/** Direct addressing of entities that know where they live. */
final class EntityAddresses {

    private EntityAddresses() {}

    static TestAddress of(SourceEntity entity) throws AddressResolutionException {
        if (entity instanceof ModuleEntity module) {
            return new TestAddress(fileOf(module), module.name(), null);
        }
        if (entity instanceof ModuleMember member) {
            var module = member.module();
            return new TestAddress(fileOf(module), module.name(), member.callPath());
        }
        // only properties are left, and they do not know their class
        throw new AddressResolutionException(
                entity.name(), "%s cannot be addressed without its declaring class".formatted(entity));
    }

    /**
     * Address of a property reached through its declaring class: the class address with the property name appended.
     * Any other owner is refused rather than guessed at.
     */
    static TestAddress ofProperty(PropertyEntity property, SourceEntity owner) throws AddressResolutionException {
        if (!(owner instanceof ClassEntity cls)) {
            throw new AddressResolutionException(
                    property.name(),
                    "%s is not a class, so it cannot own %s".formatted(owner, property));
        }
        return of(cls).appendToCallPath(property.name());
    }

    static @Nullable String fileOf(ModuleEntity module) {
        var location = module.location();
        return location == null ? null : PythonPackages.src(location).toString();
    }
}
