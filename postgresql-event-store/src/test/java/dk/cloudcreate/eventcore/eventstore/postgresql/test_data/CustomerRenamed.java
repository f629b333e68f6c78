package dk.cloudcreate.eventcore.eventstore.postgresql.test_data;

import dk.cloudcreate.eventcore.eventstore.postgresql.types.Revision;

/**
 * Revision 1 of this event had a single <code>name</code> property
 */
@Revision(2)
public class CustomerRenamed {
    public CustomerId customerId;
    public String     firstName;
    public String     lastName;

    private CustomerRenamed() {
    }

    public CustomerRenamed(CustomerId customerId, String firstName, String lastName) {
        this.customerId = customerId;
        this.firstName = firstName;
        this.lastName = lastName;
    }
}
