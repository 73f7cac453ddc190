package de.t14d3.folio.test.entities;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.annotations.Document;
import de.t14d3.folio.annotations.EmbedOne;
import de.t14d3.folio.annotations.Id;
import de.t14d3.folio.annotations.Property;
import de.t14d3.folio.annotations.ReferenceOne;

@Document(collection = "customers")
public class Customer {
    @Id
    private Long id;

    @Property
    private String name;

    @Property(name = "mail")
    private String email;

    @EmbedOne
    private Address address;

    @ReferenceOne(cascade = CascadeType.ALL, orphanRemoval = true)
    private LoyaltyCard card;

    public Customer() {}

    public Customer(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public Address getAddress() { return address; }
    public void setAddress(Address address) { this.address = address; }

    public LoyaltyCard getCard() { return card; }
    public void setCard(LoyaltyCard card) { this.card = card; }

    @Override
    public String toString() {
        return "Customer{id=" + id + ", name='" + name + "'}";
    }
}
