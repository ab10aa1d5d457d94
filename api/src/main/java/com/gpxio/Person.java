/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.gpxio;

import java.util.Objects;

/**
 * A person or organization. All fields are optional.
 */
public final class Person {
    private final String name;
    private final String email;
    private final Link link;

    /**
     * @param email the complete address like me@example.com, in GPX 1.1 it is written as id and
     *              domain attribute
     */
    public Person(String name, String email, Link link) {
        this.name = name;
        this.email = email;
        this.link = link;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public Link getLink() {
        return link;
    }

    /**
     * @return true if no field is set, such a person is treated like no person at all
     */
    public boolean isEmpty() {
        return name == null && email == null && link == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person person = (Person) o;
        return Objects.equals(name, person.name) && Objects.equals(email, person.email)
                && Objects.equals(link, person.link);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, email, link);
    }

    @Override
    public String toString() {
        return "Person{name='" + name + "', email='" + email + "', link=" + link + '}';
    }
}
