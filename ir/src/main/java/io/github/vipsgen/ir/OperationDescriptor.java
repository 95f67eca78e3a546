package io.github.vipsgen.ir;

import static java.util.Collections.unmodifiableList;
import static java.util.Comparator.comparingInt;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Shape of one operation: its identifier, human description, grouping category and construction-time arguments in
 * the order the runtime declared them.
 */
public final class OperationDescriptor {

    private final String name;
    private final String description;
    private final String category;
    private final List<ArgumentDescriptor> arguments;

    public OperationDescriptor(String name, String description, String category, List<ArgumentDescriptor> arguments) {
        this.name = requireNonNull(name, "name");
        this.description = requireNonNull(description, "description");
        this.category = requireNonNull(category, "category");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Operation name must not be empty");
        }
        if (category.isEmpty()) {
            throw new IllegalArgumentException("Operation '" + name + "' has an empty category");
        }
        Set<String> seen = new HashSet<>();
        for (ArgumentDescriptor argument : arguments) {
            if (!seen.add(argument.getName())) {
                throw new IllegalArgumentException(
                        "Operation '" + name + "' declares argument '" + argument.getName() + "' twice");
            }
        }
        this.arguments = unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<ArgumentDescriptor> getArguments() {
        return arguments;
    }

    public Optional<ArgumentDescriptor> argument(String argumentName) {
        return arguments.stream().filter(a -> a.getName().equals(argumentName)).findFirst();
    }

    /** Arguments ordered by ascending priority; ties keep declaration order. */
    public List<ArgumentDescriptor> argumentsByPriority() {
        return arguments.stream()
                .sorted(comparingInt(ArgumentDescriptor::getPriority))
                .collect(toList());
    }

    public List<ArgumentDescriptor> requiredInputs() {
        return select(a -> a.isInput() && a.isRequired());
    }

    public List<ArgumentDescriptor> optionalInputs() {
        return select(a -> a.isInput() && !a.isRequired());
    }

    public List<ArgumentDescriptor> outputs() {
        return select(ArgumentDescriptor::isOutput);
    }

    public OperationDescriptor withCategory(String category) {
        return new OperationDescriptor(name, description, category, arguments);
    }

    private List<ArgumentDescriptor> select(Predicate<ArgumentDescriptor> filter) {
        return argumentsByPriority().stream().filter(filter).collect(toList());
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationDescriptor)) {
            return false;
        }
        OperationDescriptor that = (OperationDescriptor) o;
        return name.equals(that.name)
                && description.equals(that.description)
                && category.equals(that.category)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, category, arguments);
    }

    @Override
    public String toString() {
        return "OperationDescriptor{" + name + " [" + category + "] " + arguments + "}";
    }
}
